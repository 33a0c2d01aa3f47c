package com.project.image.grainstats.geometry;

import java.util.List;

/**
 * Finds the smallest-area rectangle enclosing a point set by trying one orientation per hull edge.
 * <p>
 * For every edge the points are centred on their centroid and rotated so that the edge lies along
 * the row axis; the axis-aligned extents of the rotated points give a candidate rectangle.
 * The first candidate with the strictly smallest area wins.
 */
public final class MinimumBoundingRectangle {

    private MinimumBoundingRectangle() {}

    public static BoundingRectangle compute(List<Point> points, List<Simplex> simplices) {
        if (points.isEmpty() || simplices.isEmpty()) {
            throw new IllegalArgumentException("Need at least one point and one hull edge");
        }
        Point centroid = Point.centroid(points);

        double bestArea = Double.NaN;
        double bestAngle = 0;
        Extremes best = null;
        for (Simplex simplex : simplices) {
            Point delta = points.get(simplex.to()).minus(points.get(simplex.from()));
            double angle = Math.atan2(delta.col(), delta.row());
            Extremes extremes = Extremes.of(points, centroid, angle);

            double area = extremes.rowSpan() * extremes.colSpan();
            if (best == null || area < bestArea) {
                bestArea = area;
                bestAngle = angle;
                best = extremes;
            }
        }

        double width = Math.min(best.rowSpan(), best.colSpan());
        double length = Math.max(best.rowSpan(), best.colSpan());
        return new BoundingRectangle(width, length, bestArea, width / length, bestAngle,
                corners(best, bestAngle, centroid));
    }

    /** Rotates {@code p} by {@code -angle}. */
    static Point rotate(Point p, double angle) {
        double cos = Math.cos(angle), sin = Math.sin(angle);
        return new Point(cos * p.row() + sin * p.col(), -sin * p.row() + cos * p.col());
    }

    /** Rotates {@code p} by {@code +angle}; the inverse of {@link #rotate}. */
    static Point unrotate(Point p, double angle) {
        double cos = Math.cos(angle), sin = Math.sin(angle);
        return new Point(cos * p.row() - sin * p.col(), sin * p.row() + cos * p.col());
    }

    private static List<Point> corners(Extremes e, double angle, Point centroid) {
        List<Point> rotated = List.of(
                new Point(e.minRow(), e.minCol()),
                new Point(e.maxRow(), e.minCol()),
                new Point(e.maxRow(), e.maxCol()),
                new Point(e.minRow(), e.maxCol()));
        return rotated.stream()
                .map(corner -> unrotate(corner, angle).plus(centroid))
                .toList();
    }

    record Extremes(double minRow, double maxRow, double minCol, double maxCol) {

        static Extremes of(List<Point> points, Point centroid, double angle) {
            double minRow = Double.POSITIVE_INFINITY, maxRow = Double.NEGATIVE_INFINITY;
            double minCol = Double.POSITIVE_INFINITY, maxCol = Double.NEGATIVE_INFINITY;
            for (Point p : points) {
                Point r = rotate(p.minus(centroid), angle);
                minRow = Math.min(minRow, r.row());
                maxRow = Math.max(maxRow, r.row());
                minCol = Math.min(minCol, r.col());
                maxCol = Math.max(maxCol, r.col());
            }
            return new Extremes(minRow, maxRow, minCol, maxCol);
        }

        double rowSpan() {
            return maxRow - minRow;
        }

        double colSpan() {
            return maxCol - minCol;
        }
    }
}

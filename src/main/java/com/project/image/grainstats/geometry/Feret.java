package com.project.image.grainstats.geometry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Minimum and maximum feret diameters, measured on the convex hull of the point set.
 * <p>
 * The maximum is the largest vertex-to-vertex distance. The minimum is found with the caliper
 * argument: the narrowest enclosing strip always has one side flush with a hull edge, so for each
 * edge we take the farthest vertex from its line and keep the smallest such distance.
 */
public final class Feret {

    private Feret() {}

    public static FeretDiameters minMax(List<Point> points) {
        List<Point> distinct = new ArrayList<>(new LinkedHashSet<>(points));
        if (distinct.isEmpty()) {
            throw new IllegalArgumentException("Cannot measure feret diameters of an empty point set");
        }
        if (distinct.size() == 1) {
            Point only = distinct.get(0);
            return new FeretDiameters(0, 0, only, only);
        }

        List<Point> hull = distinct.size() < 3 ? distinct : GrahamScan.build(distinct).points();

        double max = -1;
        Point maxStart = null, maxEnd = null;
        for (int i = 0; i < hull.size(); i++) {
            for (int j = i + 1; j < hull.size(); j++) {
                double d = hull.get(i).distanceTo(hull.get(j));
                if (d > max) {
                    max = d;
                    maxStart = hull.get(i);
                    maxEnd = hull.get(j);
                }
            }
        }

        // a hull of two vertices is a segment; it has no width
        double min = hull.size() < 3 ? 0 : Double.POSITIVE_INFINITY;
        if (hull.size() >= 3) {
            for (int i = 0; i < hull.size(); i++) {
                Point a = hull.get(i);
                Point b = hull.get((i + 1) % hull.size());
                double edgeLength = a.distanceTo(b);
                double widest = 0;
                for (Point p : hull) {
                    widest = Math.max(widest, Math.abs(GrahamScan.orientation(a, b, p)) / edgeLength);
                }
                min = Math.min(min, widest);
            }
        }
        return new FeretDiameters(min, max, maxStart, maxEnd);
    }
}

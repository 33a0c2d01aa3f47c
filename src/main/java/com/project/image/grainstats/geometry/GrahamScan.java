package com.project.image.grainstats.geometry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Convex hull by Graham scan.
 * <p>
 * The anchor is the point with the smallest column, ties broken by the smallest row. All other
 * points are ordered by the angle they make with the anchor and walked in that order, dropping
 * the last hull vertex whenever it would cause a clockwise (or straight) turn. Collinear points
 * therefore never appear on the hull.
 * <p>
 * The input list is not deduplicated; hull indices refer to the first occurrence of each vertex.
 */
public final class GrahamScan {

    private GrahamScan() {}

    public static ConvexHull build(List<Point> boundary) {
        return build(boundary, ThreadLocalRandom.current());
    }

    /**
     * @param boundary the points to enclose, at least three
     * @param random   pivot source for the angular sort; the hull does not depend on it
     */
    public static ConvexHull build(List<Point> boundary, Random random) {
        if (boundary == null || boundary.size() < 3) {
            throw new IllegalArgumentException("To calculate a convex hull the point list must contain at least 3 points.");
        }

        Point anchor = findAnchor(boundary);
        List<Point> sorted = sortByAngle(boundary, anchor, random);
        // the anchor must only be added once
        sorted.remove(anchor);

        List<Point> hull = new ArrayList<>();
        hull.add(anchor);
        hull.add(sorted.get(0));

        for (Point candidate : sorted.subList(1, sorted.size())) {
            while (isClockwise(hull.get(hull.size() - 2), hull.get(hull.size() - 1), candidate)) {
                hull.remove(hull.size() - 1);
                if (hull.size() < 2) {
                    break;
                }
            }
            hull.add(candidate);
        }

        Map<Point, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < boundary.size(); i++) {
            firstIndex.putIfAbsent(boundary.get(i), i);
        }
        List<Integer> indices = new ArrayList<>(hull.size());
        for (Point p : hull) {
            indices.add(firstIndex.get(p));
        }

        List<Simplex> simplices = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            int previous = indices.get((i - 1 + indices.size()) % indices.size());
            simplices.add(new Simplex(previous, indices.get(i)));
        }
        return new ConvexHull(hull, indices, simplices);
    }

    /** Smallest column, then smallest row. The first of several identical candidates wins. */
    public static Point findAnchor(List<Point> points) {
        Point anchor = null;
        for (Point p : points) {
            if (anchor == null
                    || p.col() < anchor.col()
                    || (p.col() == anchor.col() && p.row() < anchor.row())) {
                anchor = p;
            }
        }
        return anchor;
    }

    /** Angle of {@code p} seen from {@code anchor}, in radians. */
    public static double angle(Point p, Point anchor) {
        return Math.atan2(p.col() - anchor.col(), p.row() - anchor.row());
    }

    /**
     * Returns a new list with every point ordered by increasing angle about {@code anchor};
     * points sharing an angle are ordered nearest first.
     * <p>
     * Three-way partition around a random pivot angle. Pending ranges live on an explicit stack
     * so the depth of the partitioning never reaches the call stack.
     */
    public static List<Point> sortByAngle(List<Point> points, Point anchor, Random random) {
        int n = points.size();
        double[] angles = new double[n];
        double[] distances = new double[n];
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            angles[i] = angle(points.get(i), anchor);
            distances[i] = points.get(i).squaredDistanceTo(anchor);
            order[i] = i;
        }

        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, n});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int lo = range[0], hi = range[1];
            if (hi - lo <= 1) {
                continue;
            }
            double pivot = angles[order[lo + random.nextInt(hi - lo)]];

            // [lo, lt) smaller, [lt, i) equal, [gt, hi) larger
            int lt = lo, i = lo, gt = hi;
            while (i < gt) {
                double a = angles[order[i]];
                if (a < pivot) {
                    swap(order, lt++, i++);
                } else if (a > pivot) {
                    swap(order, i, --gt);
                } else {
                    i++;
                }
            }
            Arrays.sort(order, lt, gt, Comparator.comparingDouble(idx -> distances[idx]));
            pending.push(new int[]{lo, lt});
            pending.push(new int[]{gt, hi});
        }

        List<Point> sorted = new ArrayList<>(n);
        for (Integer idx : order) {
            sorted.add(points.get(idx));
        }
        return sorted;
    }

    /**
     * Determinant of the homogeneous coordinate matrix of the three points, i.e. twice the signed
     * area of the triangle they span.
     * Positive means a counter-clockwise turn.
     */
    public static double orientation(Point p1, Point p2, Point p3) {
        return p1.row() * (p2.col() - p3.col())
                - p1.col() * (p2.row() - p3.row())
                + (p2.row() * p3.col() - p3.row() * p2.col());
    }

    /** True for clockwise and for collinear triples. */
    public static boolean isClockwise(Point p1, Point p2, Point p3) {
        return !(orientation(p1, p2, p3) > 0);
    }

    private static void swap(Integer[] a, int i, int j) {
        Integer tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}

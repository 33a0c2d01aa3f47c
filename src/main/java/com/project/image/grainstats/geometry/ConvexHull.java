package com.project.image.grainstats.geometry;

import java.util.HashSet;
import java.util.List;

/**
 * Result of a Graham scan.
 *
 * @param points    hull vertices in counter-clockwise order, starting at the anchor point
 * @param indices   index of each vertex in the boundary list it was built from
 * @param simplices hull edges; {@code simplices.get(i)} joins vertex {@code i-1} to vertex {@code i}
 */
public record ConvexHull(List<Point> points, List<Integer> indices, List<Simplex> simplices) {

    public ConvexHull {
        points = List.copyOf(points);
        indices = List.copyOf(indices);
        simplices = List.copyOf(simplices);
        if (points.size() != indices.size() || points.size() != simplices.size()) {
            throw new IllegalArgumentException("Hull points, indices and simplices must have the same length");
        }
    }

    public int size() {
        return points.size();
    }

    public int distinctPointCount() {
        return new HashSet<>(points).size();
    }
}

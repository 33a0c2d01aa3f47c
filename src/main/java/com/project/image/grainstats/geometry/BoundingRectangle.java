package com.project.image.grainstats.geometry;

import java.util.List;

/**
 * Minimum-area rectangle enclosing a point set.
 *
 * @param width       shorter side, in pixels
 * @param length      longer side, in pixels
 * @param area        width times length
 * @param aspectRatio width divided by length; {@code NaN} when both sides are zero
 * @param angle       orientation of the hull edge the rectangle is aligned with, in radians
 * @param corners     the four corners in the original coordinate frame
 */
public record BoundingRectangle(
        double width,
        double length,
        double area,
        double aspectRatio,
        double angle,
        List<Point> corners
) {
    public BoundingRectangle {
        corners = List.copyOf(corners);
    }
}

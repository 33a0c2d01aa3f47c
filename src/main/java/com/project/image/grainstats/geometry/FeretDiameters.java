package com.project.image.grainstats.geometry;

/**
 * Caliper widths of a point set, in pixels.
 *
 * @param min      smallest width over all orientations
 * @param max      largest distance between two points of the set
 * @param maxStart one end of the maximum diameter
 * @param maxEnd   the other end of the maximum diameter
 */
public record FeretDiameters(double min, double max, Point maxStart, Point maxEnd) {

    public FeretDiameters scaled(double factor) {
        return new FeretDiameters(min * factor, max * factor, maxStart, maxEnd);
    }
}

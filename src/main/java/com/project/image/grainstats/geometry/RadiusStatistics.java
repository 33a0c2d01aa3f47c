package com.project.image.grainstats.geometry;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Distances from the boundary centroid to every boundary point, in pixels.
 */
public record RadiusStatistics(Point centroid, double min, double max, double mean, double median) {

    public static RadiusStatistics of(List<Point> boundary) {
        Point centroid = Point.centroid(boundary);
        DescriptiveStatistics radii = new DescriptiveStatistics();
        for (Point p : boundary) {
            radii.addValue(p.minus(centroid).norm());
        }
        return new RadiusStatistics(centroid, radii.getMin(), radii.getMax(), radii.getMean(), radii.getPercentile(50));
    }
}

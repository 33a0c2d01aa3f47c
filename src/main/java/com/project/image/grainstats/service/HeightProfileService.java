package com.project.image.grainstats.service;

import com.project.image.grainstats.geometry.Feret;
import com.project.image.grainstats.geometry.FeretDiameters;
import com.project.image.grainstats.geometry.Point;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Samples image heights along the maximum feret diameter of a grain.
 */
@Component
public class HeightProfileService {

    /**
     * @param image grain image, cropped to the grain's bounding box
     * @param mask  grain mask, same shape as {@code image}
     * @return heights at {@code max(2, ceil(maxFeret))} evenly spaced points from one end of the
     *         maximum feret line to the other; empty when the mask is empty
     */
    public double[] interpolateHeightProfile(double[][] image, boolean[][] mask) {
        List<Point> points = BoundaryExtractor.points(mask);
        if (points.isEmpty()) {
            return new double[0];
        }
        FeretDiameters feret = Feret.minMax(points);
        Point start = feret.maxStart();
        Point end = feret.maxEnd();

        int samples = Math.max(2, (int) Math.ceil(feret.max()));
        double[] profile = new double[samples];
        for (int i = 0; i < samples; i++) {
            double t = (double) i / (samples - 1);
            double row = start.row() + t * (end.row() - start.row());
            double col = start.col() + t * (end.col() - start.col());
            profile[i] = bilinear(image, row, col);
        }
        return profile;
    }

    /** Linear interpolation on the pixel grid; coordinates must lie inside the image. */
    static double bilinear(double[][] image, double row, double col) {
        int r0 = (int) Math.floor(row);
        int c0 = (int) Math.floor(col);
        int r1 = Math.min(r0 + 1, image.length - 1);
        int c1 = Math.min(c0 + 1, image[0].length - 1);
        double fr = row - r0;
        double fc = col - c0;

        double top = lerp(image[r0][c0], image[r0][c1], fc);
        double bottom = lerp(image[r1][c0], image[r1][c1], fc);
        return lerp(top, bottom, fr);
    }

    private static double lerp(double a, double b, double t) {
        return t == 0 ? a : a + t * (b - a);
    }
}

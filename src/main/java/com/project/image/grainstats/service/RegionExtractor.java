package com.project.image.grainstats.service;

import com.project.image.grainstats.exceptions.GrainStatsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a labelled raster into per-label masks and crops image data around them.
 */
@Component
public class RegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    /**
     * @return one region per label greater than zero, in ascending label order
     */
    public List<LabelledRegion> regions(int[][] labels) {
        int h = labels.length;
        int w = h == 0 ? 0 : labels[0].length;

        // label -> {minRow, minCol, maxRow, maxCol, area}
        Map<Integer, int[]> bounds = new TreeMap<>();
        for (int y = 0; y < h; y++) {
            if (labels[y].length != w) {
                throw new GrainStatsException("Labelled image rows must all have the same length");
            }
            for (int x = 0; x < w; x++) {
                int label = labels[y][x];
                if (label < 0) {
                    throw new GrainStatsException("Negative label " + label + " at (" + y + ", " + x + ")");
                }
                if (label == 0) continue;

                int[] b = bounds.computeIfAbsent(label, l -> new int[]{Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1, 0});
                b[0] = Math.min(b[0], y);
                b[1] = Math.min(b[1], x);
                b[2] = Math.max(b[2], y + 1);
                b[3] = Math.max(b[3], x + 1);
                b[4]++;
            }
        }

        List<LabelledRegion> regions = new ArrayList<>(bounds.size());
        for (Map.Entry<Integer, int[]> e : bounds.entrySet()) {
            int label = e.getKey();
            int[] b = e.getValue();
            boolean[][] mask = new boolean[b[2] - b[0]][b[3] - b[1]];
            for (int y = b[0]; y < b[2]; y++) {
                for (int x = b[1]; x < b[3]; x++) {
                    mask[y - b[0]][x - b[1]] = labels[y][x] == label;
                }
            }
            regions.add(new LabelledRegion(label, b[0], b[1], b[2], b[3], mask, b[4]));
        }
        log.debug("Found {} labelled regions in {}x{} raster", regions.size(), w, h);
        return regions;
    }

    /** Copies the bounding box of {@code region} out of {@code image}. */
    public double[][] crop(double[][] image, LabelledRegion region) {
        return crop(image, region.minRow(), region.minCol(), region.maxRow(), region.maxCol());
    }

    /**
     * Square window of side {@code 2 * halfLength + 1} centred on the given pixel, shifted so that it stays
     * inside the image. Windows larger than the image are clipped to it.
     */
    public double[][] cropAround(double[][] image, int halfLength, int centreRow, int centreCol) {
        int h = image.length;
        int w = h == 0 ? 0 : image[0].length;
        int[] rows = window(centreRow, halfLength, h);
        int[] cols = window(centreCol, halfLength, w);
        return crop(image, rows[0], cols[0], rows[1], cols[1]);
    }

    /**
     * The mask of a single label inside the same window {@link #cropAround} would take, as 1.0 / 0.0.
     * Only the window is read.
     */
    public double[][] soloMaskAround(int[][] labels, int label, int halfLength, int centreRow, int centreCol) {
        int h = labels.length;
        int w = h == 0 ? 0 : labels[0].length;
        int[] rows = window(centreRow, halfLength, h);
        int[] cols = window(centreCol, halfLength, w);
        double[][] out = new double[rows[1] - rows[0]][cols[1] - cols[0]];
        for (int y = rows[0]; y < rows[1]; y++) {
            for (int x = cols[0]; x < cols[1]; x++) {
                out[y - rows[0]][x - cols[0]] = labels[y][x] == label ? 1.0 : 0.0;
            }
        }
        return out;
    }

    /** Image values under {@code mask}, {@code NaN} elsewhere. Both arrays must have the same shape. */
    public static double[][] maskedImage(double[][] image, boolean[][] mask) {
        double[][] out = new double[image.length][];
        for (int y = 0; y < image.length; y++) {
            out[y] = new double[image[y].length];
            for (int x = 0; x < image[y].length; x++) {
                out[y][x] = mask[y][x] ? image[y][x] : Double.NaN;
            }
        }
        return out;
    }

    public static double[][] toDouble(boolean[][] mask) {
        double[][] out = new double[mask.length][];
        for (int y = 0; y < mask.length; y++) {
            out[y] = new double[mask[y].length];
            for (int x = 0; x < mask[y].length; x++) {
                out[y][x] = mask[y][x] ? 1.0 : 0.0;
            }
        }
        return out;
    }

    private static int[] window(int centre, int halfLength, int size) {
        int start = centre - halfLength;
        int end = centre + halfLength + 1;
        if (end > size) {
            start -= end - size;
            end = size;
        }
        if (start < 0) {
            end = Math.min(size, end - start);
            start = 0;
        }
        return new int[]{start, end};
    }

    private static double[][] crop(double[][] image, int minRow, int minCol, int maxRow, int maxCol) {
        double[][] out = new double[maxRow - minRow][];
        for (int y = minRow; y < maxRow; y++) {
            out[y - minRow] = Arrays.copyOfRange(image[y], minCol, maxCol);
        }
        return out;
    }
}

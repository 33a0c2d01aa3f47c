package com.project.image.grainstats.service;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canny edge detection on binary masks, backed by OpenCV.
 */
public final class CannyEdgeDetector {
    private static final Logger log = LoggerFactory.getLogger(CannyEdgeDetector.class);

    static final double SIGMA = 3.0;
    private static final double FULL_SCALE = 255.0;
    private static final double LOW_THRESHOLD = 0.1 * FULL_SCALE;
    private static final double HIGH_THRESHOLD = 0.2 * FULL_SCALE;
    // at least the blur kernel radius plus the Sobel aperture
    static final int PADDING = (int) Math.ceil(3 * SIGMA) + 1;
    private static final int[][] CROSS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    private static final boolean AVAILABLE;

    static {
        boolean loaded;
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
            loaded = true;
        } catch (Throwable e) {
            log.error("Failed to load OpenCV, canny edge detection is unavailable", e);
            loaded = false;
        }
        AVAILABLE = loaded;
    }

    private CannyEdgeDetector() {}

    public static boolean isAvailable() {
        return AVAILABLE;
    }

    /**
     * The mask is padded with background before smoothing, so a grain that touches the border of its
     * crop still gets an outline there. Canny places an edge on either side of the mask border; edge
     * pixels just outside the mask are moved onto the mask pixel they touch.
     *
     * @return outline pixels of {@code mask}, same shape as the input; always a subset of the mask
     */
    public static boolean[][] detect(boolean[][] mask) {
        if (!AVAILABLE) {
            throw new IllegalStateException("Canny edge detection requires the OpenCV native library, which failed to load");
        }
        int h = mask.length;
        int w = mask[0].length;
        int ph = h + 2 * PADDING;
        int pw = w + 2 * PADDING;

        Mat image = new Mat(h, w, CvType.CV_8UC1);
        Mat padded = new Mat();
        Mat blurred = new Mat();
        Mat edges = new Mat();
        try {
            byte[] data = new byte[h * w];
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    data[y * w + x] = mask[y][x] ? (byte) 255 : 0;
                }
            }
            image.put(0, 0, data);

            Core.copyMakeBorder(image, padded, PADDING, PADDING, PADDING, PADDING, Core.BORDER_CONSTANT, new Scalar(0));
            Imgproc.GaussianBlur(padded, blurred, new Size(0, 0), SIGMA, SIGMA, Core.BORDER_CONSTANT);
            Imgproc.Canny(blurred, edges, LOW_THRESHOLD, HIGH_THRESHOLD, 3, true);

            byte[] edgeData = new byte[ph * pw];
            edges.get(0, 0, edgeData);
            boolean[][] out = new boolean[h][w];
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    out[y][x] = mask[y][x] && touchesEdge(mask, edgeData, pw, y, x);
                }
            }
            return out;
        } finally {
            image.release();
            padded.release();
            blurred.release();
            edges.release();
        }
    }

    /** Mask pixel {@code (y, x)} is an edge itself or 4-adjacent to an edge pixel outside the mask. */
    private static boolean touchesEdge(boolean[][] mask, byte[] edgeData, int pw, int y, int x) {
        if (edgeData[(y + PADDING) * pw + x + PADDING] != 0) {
            return true;
        }
        for (int[] dir : CROSS) {
            int yy = y + dir[0];
            int xx = x + dir[1];
            boolean inside = yy >= 0 && yy < mask.length && xx >= 0 && xx < mask[0].length && mask[yy][xx];
            if (!inside && edgeData[(yy + PADDING) * pw + xx + PADDING] != 0) {
                return true;
            }
        }
        return false;
    }
}

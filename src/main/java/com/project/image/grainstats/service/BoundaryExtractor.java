package com.project.image.grainstats.service;

import com.project.image.grainstats.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the outline pixels of a grain mask. Holes are filled before the outline is taken,
 * so only the outer edge is returned.
 */
@Component
public class BoundaryExtractor {
    private static final Logger log = LoggerFactory.getLogger(BoundaryExtractor.class);

    private static final int[][] CROSS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    /**
     * @return boundary pixels in row-major order; empty for an empty mask
     */
    public List<Point> extract(boolean[][] mask, EdgeDetectionMethod method) {
        if (mask.length == 0 || mask[0].length == 0) {
            return List.of();
        }
        boolean[][] filled = fillHoles(mask);
        boolean[][] edges = switch (method) {
            case BINARY_EROSION -> erosionEdges(filled);
            case CANNY -> CannyEdgeDetector.detect(filled);
        };

        List<Point> points = new ArrayList<>();
        for (int y = 0; y < edges.length; y++) {
            for (int x = 0; x < edges[y].length; x++) {
                if (edges[y][x]) {
                    points.add(Point.of(y, x));
                }
            }
        }
        log.trace("Extracted {} boundary points using {}", points.size(), method.key());
        return points;
    }

    /** All pixels of the mask, row-major. */
    public static List<Point> points(boolean[][] mask) {
        List<Point> points = new ArrayList<>();
        for (int y = 0; y < mask.length; y++) {
            for (int x = 0; x < mask[y].length; x++) {
                if (mask[y][x]) {
                    points.add(Point.of(y, x));
                }
            }
        }
        return points;
    }

    /** Filled mask minus its erosion; pixels outside the mask count as background. */
    static boolean[][] erosionEdges(boolean[][] filled) {
        boolean[][] eroded = erodeCross(filled);
        int h = filled.length, w = filled[0].length;
        boolean[][] edges = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                edges[y][x] = filled[y][x] && !eroded[y][x];
            }
        }
        return edges;
    }

    /** One step of erosion with the 4-connected cross; out-of-bounds neighbours are background. */
    static boolean[][] erodeCross(boolean[][] src) {
        int h = src.length, w = src[0].length;
        boolean[][] dst = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!src[y][x]) continue;

                boolean keep = true;
                for (int[] dir : CROSS) {
                    int yy = y + dir[0];
                    int xx = x + dir[1];
                    if (yy < 0 || yy >= h || xx < 0 || xx >= w || !src[yy][xx]) {
                        keep = false;
                        break;
                    }
                }
                dst[y][x] = keep;
            }
        }
        return dst;
    }

    /** Background not 4-connected to the border becomes foreground. */
    static boolean[][] fillHoles(boolean[][] src) {
        int h = src.length, w = src[0].length;
        boolean[][] outside = new boolean[h][w];
        ArrayDeque<int[]> q = new ArrayDeque<>();

        for (int x = 0; x < w; x++) {
            seed(src, outside, q, 0, x);
            seed(src, outside, q, h - 1, x);
        }
        for (int y = 1; y < h - 1; y++) {
            seed(src, outside, q, y, 0);
            seed(src, outside, q, y, w - 1);
        }

        while (!q.isEmpty()) {
            int[] p = q.removeFirst();
            for (int[] dir : CROSS) {
                int ny = p[0] + dir[0];
                int nx = p[1] + dir[1];
                if (ny >= 0 && ny < h && nx >= 0 && nx < w) {
                    seed(src, outside, q, ny, nx);
                }
            }
        }

        boolean[][] out = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[y][x] = src[y][x] || !outside[y][x];
            }
        }
        return out;
    }

    private static void seed(boolean[][] src, boolean[][] outside, ArrayDeque<int[]> q, int y, int x) {
        if (!src[y][x] && !outside[y][x]) {
            outside[y][x] = true;
            q.add(new int[]{y, x});
        }
    }
}

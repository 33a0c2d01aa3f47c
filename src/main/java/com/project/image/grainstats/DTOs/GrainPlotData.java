package com.project.image.grainstats.DTOs;

import java.nio.file.Path;

/**
 * A per-grain array handed to an external renderer.
 *
 * @param data      the array to draw, {@code NaN} where there is nothing to show
 * @param outputDir directory the renderer should write into
 * @param filename  file name without extension
 * @param name      one of {@code grain_image}, {@code grain_mask}, {@code grain_mask_image}
 */
public record GrainPlotData(double[][] data, Path outputDir, String filename, String name) {}

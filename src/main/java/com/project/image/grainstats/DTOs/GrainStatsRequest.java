package com.project.image.grainstats.DTOs;

import com.project.image.grainstats.service.EdgeDetectionMethod;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Input for one (image, direction) pair. Optional fields fall back to the configured defaults.
 *
 * @param image                    flattened height data, indexed {@code [row][col]}
 * @param labels                   grain labels, same shape as {@code image}; 0 is background; may be null
 * @param pixelToNanometreScaling  nanometres per pixel
 */
public record GrainStatsRequest(
        @NotNull @NotEmpty double[][] image,
        int[][] labels,
        @Positive double pixelToNanometreScaling,
        @NotNull Direction direction,
        String imageName,
        EdgeDetectionMethod edgeDetectionMethod,
        Boolean extractHeightProfile,
        Double croppedSize
) {}

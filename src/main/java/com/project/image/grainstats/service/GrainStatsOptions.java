package com.project.image.grainstats.service;

import com.project.image.grainstats.DTOs.GrainStatsRequest;

import java.nio.file.Path;

/**
 * Settings that apply to every grain of one computation.
 *
 * @param croppedSize        side, in nanometres, of the square plot crops; negative for tight bounding boxes
 * @param metreScalingFactor metres per nanometre
 * @param minGrainSize       grains whose shorter bounding box side is below this many pixels are skipped
 * @param baseOutputDir      root of the plot output directories
 */
public record GrainStatsOptions(
        EdgeDetectionMethod edgeDetectionMethod,
        boolean extractHeightProfile,
        double croppedSize,
        double metreScalingFactor,
        int minGrainSize,
        Path baseOutputDir
) {
    public static final double NANOMETRE_TO_METRE = 1e-9;
    public static final int DEFAULT_MIN_GRAIN_SIZE = 5;

    public static GrainStatsOptions defaults() {
        return new GrainStatsOptions(EdgeDetectionMethod.BINARY_EROSION, false, -1,
                NANOMETRE_TO_METRE, DEFAULT_MIN_GRAIN_SIZE, Path.of("grains"));
    }

    /** These options, with any non-null per-request settings taking precedence. */
    public GrainStatsOptions overriddenBy(GrainStatsRequest request) {
        return new GrainStatsOptions(
                request.edgeDetectionMethod() != null ? request.edgeDetectionMethod() : edgeDetectionMethod,
                request.extractHeightProfile() != null ? request.extractHeightProfile() : extractHeightProfile,
                request.croppedSize() != null ? request.croppedSize() : croppedSize,
                metreScalingFactor,
                minGrainSize,
                baseOutputDir);
    }

    public GrainStatsOptions withMinGrainSize(int size) {
        return new GrainStatsOptions(edgeDetectionMethod, extractHeightProfile, croppedSize, metreScalingFactor, size, baseOutputDir);
    }

    public GrainStatsOptions withEdgeDetectionMethod(EdgeDetectionMethod method) {
        return new GrainStatsOptions(method, extractHeightProfile, croppedSize, metreScalingFactor, minGrainSize, baseOutputDir);
    }

    public GrainStatsOptions withHeightProfiles(boolean extract) {
        return new GrainStatsOptions(edgeDetectionMethod, extract, croppedSize, metreScalingFactor, minGrainSize, baseOutputDir);
    }

    public GrainStatsOptions withCroppedSize(double size) {
        return new GrainStatsOptions(edgeDetectionMethod, extractHeightProfile, size, metreScalingFactor, minGrainSize, baseOutputDir);
    }
}

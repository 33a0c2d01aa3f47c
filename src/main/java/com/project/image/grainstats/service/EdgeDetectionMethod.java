package com.project.image.grainstats.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.project.image.grainstats.exceptions.GrainStatsException;

import java.util.Arrays;
import java.util.Locale;

/** How the outline of a grain mask is found. */
public enum EdgeDetectionMethod {
    /** Mask minus its one-step cross-shaped erosion. */
    BINARY_EROSION("binary_erosion"),
    /** Canny edges of the Gaussian-smoothed mask. */
    CANNY("canny");

    private final String key;

    EdgeDetectionMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static EdgeDetectionMethod fromKey(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.key.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new GrainStatsException("Unknown edge detection method: " + value
                        + ". Supported: binary_erosion, canny"));
    }
}

package com.project.image.grainstats.DTOs;

import java.util.Comparator;
import java.util.List;

/**
 * Grain records of one (image, direction) pair. The column list is always present,
 * even when no grain survived.
 */
public record GrainStatsTable(List<String> columns, List<GrainRecord> rows) {

    public static final List<String> COLUMNS = List.of(
            "grain_number", "centre_x", "centre_y",
            "radius_min", "radius_max", "radius_mean", "radius_median",
            "height_min", "height_max", "height_median", "height_mean",
            "volume", "area", "area_cartesian_bbox",
            "smallest_bounding_width", "smallest_bounding_length", "smallest_bounding_area",
            "aspect_ratio", "max_feret", "min_feret", "threshold", "image");

    public GrainStatsTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static GrainStatsTable empty() {
        return new GrainStatsTable(COLUMNS, List.of());
    }

    public static GrainStatsTable of(List<GrainRecord> rows) {
        return new GrainStatsTable(COLUMNS, rows.stream()
                .sorted(Comparator.comparingInt(GrainRecord::grainNumber))
                .toList());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}

package com.project.image.grainstats.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Everything computed for one (image, direction) pair. {@code error} is only set on batch entries
 * whose computation failed; their table is empty.
 */
public record GrainStatsResult(
        String imageName,
        Direction direction,
        GrainStatsTable table,
        List<GrainPlotData> plotData,
        Map<Integer, double[]> heightProfiles,
        List<SkippedGrain> skipped,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public GrainStatsResult(String imageName, Direction direction, GrainStatsTable table, List<GrainPlotData> plotData,
                            Map<Integer, double[]> heightProfiles, List<SkippedGrain> skipped) {
        this(imageName, direction, table, plotData, heightProfiles, skipped, null);
    }

    public static GrainStatsResult empty(String imageName, Direction direction) {
        return new GrainStatsResult(imageName, direction, GrainStatsTable.empty(), List.of(), Map.of(), List.of());
    }

    public static GrainStatsResult failed(String imageName, Direction direction, String error) {
        return new GrainStatsResult(imageName, direction, GrainStatsTable.empty(), List.of(), Map.of(), List.of(), error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}

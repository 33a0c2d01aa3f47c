package com.project.image.grainstats.controller;

import com.project.image.grainstats.DTOs.GrainStatsRequest;
import com.project.image.grainstats.DTOs.GrainStatsResult;
import com.project.image.grainstats.exceptions.GrainStatsException;
import com.project.image.grainstats.service.GrainStatisticsService;
import com.project.image.grainstats.service.GrainStatsBatchService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequestMapping(value = "/api/grainstats", produces = MediaType.APPLICATION_JSON_VALUE)
public class GrainStatsController {
    private static final Logger log = LoggerFactory.getLogger(GrainStatsController.class);

    private final GrainStatisticsService grainStatisticsService;
    private final GrainStatsBatchService batchService;

    @Value("${app.grainstats.max-image-size:4096}")
    private int maxImageSize;

    public GrainStatsController(GrainStatisticsService grainStatisticsService, GrainStatsBatchService batchService) {
        this.grainStatisticsService = grainStatisticsService;
        this.batchService = batchService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public GrainStatsResult calculate(
            @RequestBody @Valid GrainStatsRequest request,
            @RequestParam(name = "includePlotData", defaultValue = "false") boolean includePlotData
    ) {
        validateImageSize(request);
        log.info("Calculating grain statistics for {} ({}), {}x{} px",
                request.imageName(), request.direction(), request.image().length, request.image()[0].length);

        GrainStatsResult result = grainStatisticsService.calculateStats(request);
        return includePlotData ? result : withoutPlotData(result);
    }

    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<GrainStatsResult> calculateBatch(
            @RequestBody @NotEmpty List<@Valid GrainStatsRequest> requests,
            @RequestParam(name = "includePlotData", defaultValue = "false") boolean includePlotData
    ) {
        requests.forEach(this::validateImageSize);
        log.info("Calculating grain statistics for a batch of {} images", requests.size());

        List<GrainStatsResult> results = batchService.calculateAll(requests);
        return includePlotData ? results : results.stream().map(GrainStatsController::withoutPlotData).toList();
    }

    private void validateImageSize(GrainStatsRequest request) {
        int rows = request.image().length;
        int cols = request.image()[0].length;
        if (rows > maxImageSize || cols > maxImageSize) {
            throw new GrainStatsException("Image is too large. Maximum size: " + maxImageSize + "x" + maxImageSize + " pixels");
        }
    }

    private static GrainStatsResult withoutPlotData(GrainStatsResult result) {
        return new GrainStatsResult(result.imageName(), result.direction(), result.table(), List.of(),
                result.heightProfiles(), result.skipped(), result.error());
    }
}

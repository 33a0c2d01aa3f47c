package com.project.image.grainstats.service;

import com.project.image.grainstats.DTOs.GrainStatsRequest;
import com.project.image.grainstats.DTOs.GrainStatsResult;
import com.project.image.grainstats.exceptions.GrainStatsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs independent (image, direction) computations on a shared worker pool.
 * Grains within one request are still processed one after another.
 */
@Service
public class GrainStatsBatchService {
    private static final Logger log = LoggerFactory.getLogger(GrainStatsBatchService.class);

    private final GrainStatisticsService grainStatisticsService;
    private final ExecutorService executor;

    public GrainStatsBatchService(GrainStatisticsService grainStatisticsService,
                                  @Qualifier("grainStatsExecutor") ExecutorService executor) {
        this.grainStatisticsService = grainStatisticsService;
        this.executor = executor;
    }

    /**
     * A request that fails does not affect the others: its entry carries the error message and an
     * empty table. Only an interrupt aborts the whole batch.
     *
     * @return one result per request, in request order
     */
    public List<GrainStatsResult> calculateAll(List<GrainStatsRequest> requests) {
        log.info("Submitting {} grain statistics requests", requests.size());
        List<Future<GrainStatsResult>> futures = new ArrayList<>(requests.size());
        for (GrainStatsRequest request : requests) {
            futures.add(executor.submit(() -> grainStatisticsService.calculateStats(request)));
        }

        List<GrainStatsResult> results = new ArrayList<>(requests.size());
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            GrainStatsRequest request = requests.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new GrainStatsException("Interrupted while calculating grain statistics for " + request.imageName(), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof GrainStatsException) {
                    log.warn("[{}] : Grain statistics failed: {}", request.imageName(), cause.getMessage());
                } else {
                    log.error("[{}] : Grain statistics failed", request.imageName(), cause);
                }
                results.add(GrainStatsResult.failed(request.imageName(), request.direction(), cause.getMessage()));
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Batch finished with {} of {} requests failed", failed, requests.size());
        }
        return results;
    }
}

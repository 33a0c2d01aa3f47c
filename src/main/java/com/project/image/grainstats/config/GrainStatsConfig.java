package com.project.image.grainstats.config;

import com.project.image.grainstats.service.EdgeDetectionMethod;
import com.project.image.grainstats.service.GrainStatsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default grain statistics settings and the worker pool for batch requests,
 * read from {@code app.grainstats.*}.
 */
@Configuration
public class GrainStatsConfig {
    private static final Logger log = LoggerFactory.getLogger(GrainStatsConfig.class);

    @Bean
    public GrainStatsOptions grainStatsOptions(
            @Value("${app.grainstats.edge-detection-method:binary_erosion}") String edgeDetectionMethod,
            @Value("${app.grainstats.extract-height-profile:false}") boolean extractHeightProfile,
            @Value("${app.grainstats.cropped-size:-1}") double croppedSize,
            @Value("${app.grainstats.metre-scaling-factor:1e-9}") double metreScalingFactor,
            @Value("${app.grainstats.min-grain-size:5}") int minGrainSize,
            @Value("${app.grainstats.base-output-dir:grains}") String baseOutputDir) {
        GrainStatsOptions options = new GrainStatsOptions(
                EdgeDetectionMethod.fromKey(edgeDetectionMethod),
                extractHeightProfile,
                croppedSize,
                metreScalingFactor,
                minGrainSize,
                Paths.get(baseOutputDir).toAbsolutePath().normalize());
        log.info("Grain statistics defaults: {}", options);
        return options;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService grainStatsExecutor(@Value("${app.grainstats.worker-threads:0}") int workerThreads) {
        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "grainstats-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("Using {} grain statistics worker threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }
}

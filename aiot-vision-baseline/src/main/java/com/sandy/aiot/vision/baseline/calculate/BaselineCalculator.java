package com.sandy.aiot.vision.baseline.calculate;

import com.sandy.aiot.vision.baseline.fetcher.FetchReadiness;
import com.sandy.aiot.vision.baseline.fetcher.Fetcher;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.predict.PredictService;
import com.sandy.aiot.vision.baseline.result.ResultManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the baseline calculation of all metrics. Every metric is calculated by its own task,
 * results are saved in the order the tasks complete.
 * <p>
 * Metric tasks share the JVM: exceptions and errors thrown by a metric only fail that metric, while
 * resource exhaustion such as an {@link OutOfMemoryError} or a thread leak can still affect the others.
 */
@Service
@Slf4j
public class BaselineCalculator {

    private final Fetcher fetcher;
    private final PredictService predictService;
    private final ResultManager resultManager;
    private final int parallelism;

    public BaselineCalculator(Fetcher fetcher, PredictService predictService, ResultManager resultManager,
                              @Value("${baseline.calculate.parallelism:0}") int parallelism) {
        this.fetcher = fetcher;
        this.predictService = predictService;
        this.resultManager = resultManager;
        this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    public RunSummary start() {
        List<String> metricNames = fetcher.metricNames();
        if (metricNames == null || metricNames.isEmpty()) {
            log.error("No metrics configured, skip the baseline calculation");
            return RunSummary.aborted();
        }
        FetchReadiness readiness;
        try {
            readiness = fetcher.readyFetch();
        } catch (Exception e) {
            log.error("Failed to get ready for fetching metrics: {}", e.getMessage(), e);
            return RunSummary.aborted();
        }

        long start = System.currentTimeMillis();
        log.info("Start to calculate baseline of {} metrics: {}", metricNames.size(), metricNames);
        List<String> saved = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, metricNames.size()),
                new CustomizableThreadFactory("baseline-metric-"));
        try {
            CompletionService<MetricOutcome> completion = new ExecutorCompletionService<>(executor);
            for (String metricName : metricNames) {
                completion.submit(() -> calculate(metricName, readiness));
            }
            for (int i = 0; i < metricNames.size(); i++) {
                Future<MetricOutcome> future = completion.take();
                MetricOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    log.error("Metric task failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                    continue;
                }
                if (outcome.results() != null && persist(outcome)) {
                    saved.add(outcome.metricName());
                } else {
                    failed.add(outcome.metricName());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Baseline calculation interrupted");
        } finally {
            executor.shutdownNow();
        }

        boolean complete = saved.size() == metricNames.size();
        RunSummary summary = new RunSummary(complete ? RunSummary.State.DONE : RunSummary.State.PARTIAL_FAILURE, saved, failed);
        log.info("Baseline calculation finished in {}ms: state={} saved={} failed={}",
                System.currentTimeMillis() - start, summary.state(), saved, failed);
        return summary;
    }

    private boolean persist(MetricOutcome outcome) {
        try {
            return resultManager.save(outcome.metricName(), outcome.results());
        } catch (RuntimeException e) {
            log.error("Failed to save baseline of {}: {}", outcome.metricName(), e.getMessage(), e);
            return false;
        }
    }

    private MetricOutcome calculate(String metricName, FetchReadiness readiness) {
        long start = System.currentTimeMillis();
        try {
            List<PredictMeterResult> results = predictService.predict(metricName, readiness);
            log.info("Calculated baseline of {} for {} services in {}ms", metricName, results.size(), System.currentTimeMillis() - start);
            return new MetricOutcome(metricName, results);
        } catch (Throwable t) {
            log.error("Failed to calculate baseline of {}: {}", metricName, t.getMessage(), t);
            return new MetricOutcome(metricName, null);
        }
    }

    private record MetricOutcome(String metricName, List<PredictMeterResult> results) {
    }
}

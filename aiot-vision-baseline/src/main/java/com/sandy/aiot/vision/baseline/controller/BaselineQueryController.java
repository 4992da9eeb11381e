package com.sandy.aiot.vision.baseline.controller;

import com.sandy.aiot.vision.baseline.fetcher.Fetcher;
import com.sandy.aiot.vision.baseline.model.PredictLabeledValue;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.model.PredictTimestampValue;
import com.sandy.aiot.vision.baseline.model.PredictValue;
import com.sandy.aiot.vision.baseline.result.ResultManager;
import com.sandy.aiot.vision.baseline.result.TimeBucketStep;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineRequest;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.BaselineValue;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.LabelWithValue;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.LabeledValue;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.MetricPrediction;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.PredictedValue;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.ServiceMetric;
import com.sandy.aiot.vision.baseline.vo.AlarmBaselineResponse.SingleValue;
import com.sandy.aiot.vision.baseline.vo.MetricsNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read side of the stored baselines: supported metric names and predicted values by time bucket.
 */
@RestController
@RequestMapping("/api/baseline")
@RequiredArgsConstructor
@Slf4j
public class BaselineQueryController {

    private final Fetcher fetcher;
    private final ResultManager resultManager;

    @GetMapping("/metrics")
    public MetricsNames supportedMetricsNames() {
        return new MetricsNames(fetcher.metricNames());
    }

    @PostMapping("/predictions")
    public AlarmBaselineResponse predictedMetrics(@RequestBody AlarmBaselineRequest request) {
        validate(request);
        Set<String> supported = new HashSet<>(fetcher.metricNames());
        Map<String, Set<String>> metricsByService = new LinkedHashMap<>();
        for (AlarmBaselineRequest.ServiceMetricNames s : request.getServiceMetricNames()) {
            if (s.getServiceName() == null || s.getMetricNames() == null) continue;
            for (String metricName : s.getMetricNames()) {
                if (!supported.contains(metricName)) {
                    log.warn("Ignore unsupported metric '{}' of service {}", metricName, s.getServiceName());
                    continue;
                }
                metricsByService.computeIfAbsent(s.getServiceName(), k -> new LinkedHashSet<>()).add(metricName);
            }
        }
        log.info("receive query predict metrics query, total service with metrics count: {}", metricsByService.size());

        TimeBucketStep step = request.getStep();
        List<ServiceMetric> serviceMetrics = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : metricsByService.entrySet()) {
            Map<String, PredictMeterResult> found = resultManager.query(entry.getKey(), entry.getValue(),
                    request.getStartTimeBucket(), request.getEndTimeBucket(), step);
            if (found.isEmpty()) continue;
            List<MetricPrediction> predictions = new ArrayList<>();
            found.forEach((metricName, result) -> predictions.add(new MetricPrediction(metricName, toValues(result, step))));
            serviceMetrics.add(new ServiceMetric(entry.getKey(), predictions));
        }
        return AlarmBaselineResponse.builder().serviceMetrics(serviceMetrics).build();
    }

    private void validate(AlarmBaselineRequest request) {
        if (request.getStep() == null) {
            throw new IllegalArgumentException("step is required");
        }
        if (request.getStartTimeBucket() == null || request.getEndTimeBucket() == null) {
            throw new IllegalArgumentException("startTimeBucket and endTimeBucket are required");
        }
        if (request.getStartTimeBucket() > request.getEndTimeBucket()) {
            throw new IllegalArgumentException("startTimeBucket must not be after endTimeBucket");
        }
        if (request.getServiceMetricNames() == null) {
            request.setServiceMetricNames(new ArrayList<>());
        }
    }

    private List<PredictedValue> toValues(PredictMeterResult result, TimeBucketStep step) {
        List<PredictedValue> values = new ArrayList<>();
        if (result.getSingle() != null) {
            for (PredictTimestampValue v : result.getSingle()) {
                values.add(new PredictedValue(step.bucketOf(v.getTimestamp()), new SingleValue(toBaseline(v.getValue())), null));
            }
            return values;
        }
        if (result.getLabeled() == null) return values;
        Map<Long, List<LabelWithValue>> byBucket = new TreeMap<>();
        for (PredictLabeledValue labeled : result.getLabeled()) {
            for (PredictTimestampValue v : labeled.getTimeWithValues()) {
                byBucket.computeIfAbsent(step.bucketOf(v.getTimestamp()), k -> new ArrayList<>())
                        .add(new LabelWithValue(labeled.getLabel().getPairs(), toBaseline(v.getValue())));
            }
        }
        byBucket.forEach((bucket, labels) -> values.add(new PredictedValue(bucket, null, new LabeledValue(labels))));
        return values;
    }

    private static BaselineValue toBaseline(PredictValue value) {
        return new BaselineValue((long) value.getValue(), (long) value.getUpperValue(), (long) value.getLowerValue());
    }
}

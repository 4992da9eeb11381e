package com.sandy.aiot.vision.baseline.result;

import com.sandy.aiot.vision.baseline.model.PredictMeterResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface ResultManager {

    /**
     * Replaces everything stored for the metric.
     *
     * @return false if the result could not be written
     */
    boolean save(String metricName, List<PredictMeterResult> results);

    /**
     * Predictions of one service restricted to the inclusive bucket range. Metrics without a matching
     * point are left out.
     *
     * @return metric name to the service's prediction
     */
    Map<String, PredictMeterResult> query(String serviceName, Collection<String> metricNames,
                                          long startTimeBucket, long endTimeBucket, TimeBucketStep step);
}

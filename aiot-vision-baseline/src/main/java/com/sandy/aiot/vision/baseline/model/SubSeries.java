package com.sandy.aiot.vision.baseline.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One independently forecastable series: a service's whole single-valued metric, or one label set
 * of a multi-valued metric. Points are sorted by timestamp.
 *
 * @param label null for single-valued metrics
 */
public record SubSeries(String serviceName, LabelSet label, List<TimeSeriesPoint> points) {

    public SubSeries {
        points = List.copyOf(points);
    }

    public boolean isLabeled() {
        return label != null;
    }

    public int size() {
        return points.size();
    }

    public LocalDateTime maxTimestamp() {
        return points.isEmpty() ? null : points.get(points.size() - 1).timestamp();
    }

    public String describe() {
        return label == null ? serviceName : serviceName + label;
    }
}

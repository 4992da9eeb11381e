package com.sandy.aiot.vision.baseline.predict;

import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import com.sandy.aiot.vision.baseline.fetcher.FetchedData;
import com.sandy.aiot.vision.baseline.fetcher.FetchedRow;
import com.sandy.aiot.vision.baseline.model.LabelSet;
import com.sandy.aiot.vision.baseline.model.SubSeries;
import com.sandy.aiot.vision.baseline.model.TimeSeriesPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a fetched dataset into sub-series and drops the ones with too little history.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SubSeriesPartitioner {

    private final BaselineProperties properties;

    /**
     * Minimum number of points a sub-series needs: minDays * pointsPerDay.
     */
    public int threshold() {
        BaselineProperties.Predict predict = properties.getPredict();
        return predict.getMinDays() * predict.getPointsPerDay();
    }

    public List<SubSeries> split(String metricName, FetchedData data) {
        if (data == null || data.getRows().isEmpty()) return List.of();
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(data.getTimeFormat());
        Map<String, List<FetchedRow>> byService = new LinkedHashMap<>();
        for (FetchedRow row : data.getRows()) {
            byService.computeIfAbsent(row.serviceName(), k -> new ArrayList<>()).add(row);
        }
        List<SubSeries> result = new ArrayList<>();
        for (Map.Entry<String, List<FetchedRow>> entry : byService.entrySet()) {
            if (data.getShape() == FetchedData.Shape.SINGLE) {
                splitSingle(metricName, entry.getKey(), entry.getValue(), formatter, result);
            } else {
                splitMultiple(metricName, entry.getKey(), entry.getValue(), data, formatter, result);
            }
        }
        return result;
    }

    private void splitSingle(String metricName, String service, List<FetchedRow> rows,
                             DateTimeFormatter formatter, List<SubSeries> out) {
        List<TimeSeriesPoint> points = toPoints(rows, formatter);
        int threshold = threshold();
        if (points.size() < threshold) {
            log.info("Skipping {}({}), less than {} days(needs {} count) data points(current: {})",
                    service, metricName, properties.getPredict().getMinDays(), threshold, points.size());
            return;
        }
        out.add(new SubSeries(service, null, points));
    }

    private void splitMultiple(String metricName, String service, List<FetchedRow> rows, FetchedData data,
                               DateTimeFormatter formatter, List<SubSeries> out) {
        Map<LabelSet, List<FetchedRow>> byLabel = new LinkedHashMap<>();
        for (LabelSet label : data.getLabelColumns()) {
            byLabel.put(label, new ArrayList<>());
        }
        for (FetchedRow row : rows) {
            LabelSet label = row.label() == null ? LabelSet.EMPTY : row.label();
            byLabel.computeIfAbsent(label, k -> new ArrayList<>()).add(row);
        }
        int threshold = threshold();
        int kept = 0;
        for (Map.Entry<LabelSet, List<FetchedRow>> entry : byLabel.entrySet()) {
            List<TimeSeriesPoint> points = toPoints(entry.getValue(), formatter);
            if (points.size() < threshold) {
                log.warn("Skipping {}({}), labels: {}, less than {} data points(current: {})",
                        service, metricName, entry.getKey(), threshold, points.size());
                continue;
            }
            out.add(new SubSeries(service, entry.getKey(), points));
            kept++;
        }
        if (kept == 0) {
            log.warn("Skipping {}({}), no valid (labels) data points", service, metricName);
        }
    }

    private List<TimeSeriesPoint> toPoints(List<FetchedRow> rows, DateTimeFormatter formatter) {
        List<TimeSeriesPoint> points = new ArrayList<>(rows.size());
        for (FetchedRow row : rows) {
            if (row.time() == null || Double.isNaN(row.value())) continue;
            LocalDateTime ts;
            try {
                ts = LocalDateTime.parse(row.time(), formatter);
            } catch (DateTimeParseException e) {
                log.debug("Drop row with unparseable time '{}'", row.time());
                continue;
            }
            points.add(new TimeSeriesPoint(ts, row.value()));
        }
        points.sort(Comparator.comparing(TimeSeriesPoint::timestamp));
        return points;
    }
}

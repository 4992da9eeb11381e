package com.sandy.aiot.vision.baseline.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import com.sandy.aiot.vision.baseline.model.PredictLabeledValue;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.model.PredictTimestampValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Stores the prediction of every metric in its own {@code <metric>.json} file, keyed by service name.
 * A save rewrites the whole file.
 */
@Service
@Slf4j
public class MeterNameResultManager implements ResultManager {

    /**
     * Metric names become file names, so only plain names without separators are accepted.
     */
    public static final String METRIC_NAME_PATTERN = "[A-Za-z0-9_][A-Za-z0-9_.-]*";

    private static final Pattern METRIC_NAME = Pattern.compile(METRIC_NAME_PATTERN);

    private static final TypeReference<LinkedHashMap<String, PredictMeterResult>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path dir;
    private final ObjectMapper objectMapper;

    @Autowired
    public MeterNameResultManager(BaselineProperties properties) {
        this(Paths.get(properties.getResult().getDir()));
    }

    MeterNameResultManager(Path dir) {
        this.dir = dir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Baseline results are stored in {}", dir.toAbsolutePath());
    }

    @Override
    public boolean save(String metricName, List<PredictMeterResult> results) {
        Map<String, PredictMeterResult> byService = new LinkedHashMap<>();
        for (PredictMeterResult r : results) {
            byService.put(r.getServiceName(), r);
        }
        if (!isValidMetricName(metricName)) {
            log.error("Refuse to save baseline of invalid metric name '{}'", metricName);
            return false;
        }
        Path target = fileOf(metricName);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, metricName + ".", ".tmp");
            objectMapper.writeValue(tmp.toFile(), byService);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved baseline of {} for {} services to {}", metricName, byService.size(), target);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save baseline of {} to {}: {}", metricName, target, e.getMessage(), e);
            deleteQuietly(tmp);
            return false;
        }
    }

    @Override
    public Map<String, PredictMeterResult> query(String serviceName, Collection<String> metricNames,
                                                 long startTimeBucket, long endTimeBucket, TimeBucketStep step) {
        if (!step.isSupported()) {
            log.warn("Time bucket step {} is not supported, every point is encoded as bucket 0", step);
        }
        Map<String, PredictMeterResult> result = new LinkedHashMap<>();
        for (String metricName : metricNames) {
            if (!isValidMetricName(metricName)) {
                log.warn("Skip querying invalid metric name '{}'", metricName);
                continue;
            }
            Map<String, PredictMeterResult> stored = load(metricName);
            PredictMeterResult service = stored.get(serviceName);
            if (service == null) continue;
            PredictMeterResult filtered = filter(service, startTimeBucket, endTimeBucket, step);
            if (filtered.hasValues()) {
                result.put(metricName, filtered);
            }
        }
        return result;
    }

    Map<String, PredictMeterResult> load(String metricName) {
        Path file = fileOf(metricName);
        if (!Files.exists(file)) {
            log.info("No baseline stored for {}", metricName);
            return Map.of();
        }
        try {
            Map<String, PredictMeterResult> stored = objectMapper.readValue(file.toFile(), FILE_TYPE);
            return stored == null ? Map.of() : stored;
        } catch (JsonProcessingException e) {
            log.error("Malformed baseline file {}: {}", file, e.getOriginalMessage());
            return Map.of();
        } catch (IOException e) {
            log.error("Failed to read baseline file {}: {}", file, e.getMessage(), e);
            return Map.of();
        }
    }

    private PredictMeterResult filter(PredictMeterResult service, long start, long end, TimeBucketStep step) {
        PredictMeterResult filtered = PredictMeterResult.builder().serviceName(service.getServiceName()).build();
        if (service.getSingle() != null) {
            filtered.setSingle(filterValues(service.getSingle(), start, end, step));
        }
        if (service.getLabeled() != null) {
            List<PredictLabeledValue> labeled = new ArrayList<>();
            for (PredictLabeledValue l : service.getLabeled()) {
                List<PredictTimestampValue> values = filterValues(l.getTimeWithValues(), start, end, step);
                if (!values.isEmpty()) labeled.add(new PredictLabeledValue(l.getLabel(), values));
            }
            filtered.setLabeled(labeled);
        }
        return filtered;
    }

    private List<PredictTimestampValue> filterValues(List<PredictTimestampValue> values, long start, long end, TimeBucketStep step) {
        List<PredictTimestampValue> result = new ArrayList<>();
        if (values == null) return result;
        for (PredictTimestampValue v : values) {
            if (v.getTimestamp() == null) continue;
            long bucket = step.bucketOf(v.getTimestamp());
            if (bucket >= start && bucket <= end) result.add(v);
        }
        return result;
    }

    static boolean isValidMetricName(String metricName) {
        return metricName != null && METRIC_NAME.matcher(metricName).matches();
    }

    private Path fileOf(String metricName) {
        return dir.resolve(metricName + ".json");
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}

package com.sandy.aiot.vision.baseline.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sandy.aiot.vision.baseline.model.LabelKeyValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Predicted baselines grouped by service, then metric, then time bucket. Values are whole numbers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlarmBaselineResponse {
    @Builder.Default
    private List<ServiceMetric> serviceMetrics = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceMetric {
        private String serviceName;
        private List<MetricPrediction> predictions;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricPrediction {
        private String name;
        private List<PredictedValue> values;
    }

    /**
     * Either {@code singleValue} or {@code labeledValue} is present.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PredictedValue {
        private long timeBucket;
        private SingleValue singleValue;
        private LabeledValue labeledValue;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SingleValue {
        private BaselineValue value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LabeledValue {
        private List<LabelWithValue> values;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LabelWithValue {
        private List<LabelKeyValue> labels;
        private BaselineValue value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BaselineValue {
        private long value;
        private long upperValue;
        private long lowerValue;
    }
}

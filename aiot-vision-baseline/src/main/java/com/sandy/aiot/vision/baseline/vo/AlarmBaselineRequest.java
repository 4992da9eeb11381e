package com.sandy.aiot.vision.baseline.vo;

import com.sandy.aiot.vision.baseline.result.TimeBucketStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlarmBaselineRequest {
    @Builder.Default
    private List<ServiceMetricNames> serviceMetricNames = new ArrayList<>();
    private Long startTimeBucket;
    private Long endTimeBucket;
    private TimeBucketStep step;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceMetricNames {
        private String serviceName;
        private List<String> metricNames;
    }
}

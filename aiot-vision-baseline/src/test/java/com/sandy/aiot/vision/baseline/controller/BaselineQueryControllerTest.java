package com.sandy.aiot.vision.baseline.controller;

import com.sandy.aiot.vision.baseline.model.LabelKeyValue;
import com.sandy.aiot.vision.baseline.model.LabelSet;
import com.sandy.aiot.vision.baseline.model.PredictLabeledValue;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.model.PredictTimestampValue;
import com.sandy.aiot.vision.baseline.model.PredictValue;
import com.sandy.aiot.vision.baseline.result.ResultManager;
import com.sandy.aiot.vision.baseline.result.TimeBucketStep;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class BaselineQueryControllerTest {

    private static final LocalDateTime T10 = LocalDateTime.of(2024, 1, 1, 10, 0);

    @Autowired MockMvc mockMvc;
    @MockBean ResultManager resultManager;

    @Test
    void supportedMetricNamesAreTheEnabledOnes() throws Exception {
        mockMvc.perform(get("/api/baseline/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricNames", contains("service_cpm", "service_resp_time", "service_percentile")));
    }

    @Test
    void singleValuesAreTruncatedToWholeNumbers() throws Exception {
        PredictMeterResult single = PredictMeterResult.builder().serviceName("svc-a")
                .single(List.of(new PredictTimestampValue(T10, new PredictValue(12.9, 20.2, -3.7))))
                .build();
        when(resultManager.query(eq("svc-a"), eq(Set.of("service_cpm")), eq(2024010100L), eq(2024010123L), eq(TimeBucketStep.HOUR)))
                .thenReturn(Map.of("service_cpm", single));

        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content(request("[{\"serviceName\":\"svc-a\",\"metricNames\":[\"service_cpm\"]}]", 2024010100L, 2024010123L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.serviceMetrics", hasSize(1)))
                .andExpect(jsonPath("$.serviceMetrics[0].serviceName").value("svc-a"))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].name").value("service_cpm"))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].timeBucket").value(2024010110L))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].singleValue.value.value").value(12))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].singleValue.value.upperValue").value(20))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].singleValue.value.lowerValue").value(-3))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].labeledValue").doesNotExist());
    }

    @Test
    void labeledValuesAreGroupedPerBucket() throws Exception {
        LabelSet p50 = LabelSet.of(new LabelKeyValue("p", "50"));
        LabelSet p99 = LabelSet.of(new LabelKeyValue("p", "99"));
        PredictMeterResult labeled = PredictMeterResult.builder().serviceName("svc-a")
                .labeled(List.of(
                        new PredictLabeledValue(p50, List.of(value(T10.plusHours(1), 5), value(T10, 4))),
                        new PredictLabeledValue(p99, List.of(value(T10, 9)))))
                .build();
        Map<String, PredictMeterResult> found = new LinkedHashMap<>();
        found.put("service_percentile", labeled);
        when(resultManager.query(eq("svc-a"), eq(Set.of("service_percentile", "service_cpm")), anyLong(), anyLong(), eq(TimeBucketStep.HOUR)))
                .thenReturn(found);
        when(resultManager.query(eq("svc-empty"), any(), anyLong(), anyLong(), eq(TimeBucketStep.HOUR)))
                .thenReturn(Map.of());

        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content(request("[{\"serviceName\":\"svc-a\",\"metricNames\":[\"service_percentile\"]},"
                                + "{\"serviceName\":\"svc-empty\",\"metricNames\":[\"service_cpm\"]},"
                                + "{\"serviceName\":\"svc-a\",\"metricNames\":[\"service_cpm\"]}]", 2024010100L, 2024010123L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.serviceMetrics", hasSize(1)))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values", hasSize(2)))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].timeBucket").value(2024010110L))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].labeledValue.values", hasSize(2)))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].labeledValue.values[1].labels[0].key").value("p"))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[0].labeledValue.values[1].labels[0].value").value("99"))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[1].timeBucket").value(2024010111L))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[1].labeledValue.values[0].value.value").value(5))
                .andExpect(jsonPath("$.serviceMetrics[0].predictions[0].values[1].singleValue").doesNotExist());
    }

    @Test
    void unsupportedMetricNamesNeverReachTheStore() throws Exception {
        when(resultManager.query(eq("svc-a"), eq(Set.of("service_cpm")), anyLong(), anyLong(), eq(TimeBucketStep.HOUR)))
                .thenReturn(Map.of());

        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content(request("[{\"serviceName\":\"svc-a\",\"metricNames\":[\"../other/secret\",\"service_cpm\",\"service_sla\"]},"
                                + "{\"serviceName\":\"svc-b\",\"metricNames\":[\"../other/secret\"]}]", 2024010100L, 2024010123L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.serviceMetrics", hasSize(0)));

        verify(resultManager).query(eq("svc-a"), eq(Set.of("service_cpm")), anyLong(), anyLong(), eq(TimeBucketStep.HOUR));
        verify(resultManager, never()).query(eq("svc-b"), any(), anyLong(), anyLong(), any());
    }

    @Test
    void missingStepIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serviceMetricNames\":[],\"startTimeBucket\":2024010100,\"endTimeBucket\":2024010123}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("step")));
        verify(resultManager, never()).query(any(), any(), anyLong(), anyLong(), any());
    }

    @Test
    void invertedRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content(request("[]", 2024010123L, 2024010100L)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.timestamp", notNullValue()));
    }

    @Test
    void unknownStepIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/baseline/predictions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serviceMetricNames\":[],\"startTimeBucket\":1,\"endTimeBucket\":2,\"step\":\"DAY\"}"))
                .andExpect(status().isBadRequest());
    }

    private static PredictTimestampValue value(LocalDateTime ts, double v) {
        return new PredictTimestampValue(ts, new PredictValue(v, v + 1, v - 1));
    }

    private static String request(String serviceMetricNames, long start, long end) {
        return "{\"serviceMetricNames\":" + serviceMetricNames + ",\"startTimeBucket\":" + start
                + ",\"endTimeBucket\":" + end + ",\"step\":\"HOUR\"}";
    }
}

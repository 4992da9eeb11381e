package com.sandy.aiot.vision.baseline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Prediction of one metric for one service. Exactly one of {@code single} and {@code labeled} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictMeterResult {
    private String serviceName;
    private List<PredictTimestampValue> single;
    private List<PredictLabeledValue> labeled;

    @JsonIgnore
    public boolean hasValues() {
        if (single != null && !single.isEmpty()) return true;
        if (labeled == null) return false;
        for (PredictLabeledValue l : labeled) {
            if (l.getTimeWithValues() != null && !l.getTimeWithValues().isEmpty()) return true;
        }
        return false;
    }
}

package com.sandy.aiot.vision.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Predicted points of one label set of a multi-valued metric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictLabeledValue {
    private LabelSet label;
    private List<PredictTimestampValue> timeWithValues;
}

package com.sandy.aiot.vision.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictValue {
    private double value;
    private double upperValue;
    private double lowerValue;
}

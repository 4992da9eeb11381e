package com.sandy.aiot.vision.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictTimestampValue {
    private LocalDateTime timestamp;
    private PredictValue value;
}

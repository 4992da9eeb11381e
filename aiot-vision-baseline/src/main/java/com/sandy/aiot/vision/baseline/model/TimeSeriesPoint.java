package com.sandy.aiot.vision.baseline.model;

import java.time.LocalDateTime;

/**
 * One observed (timestamp, value) pair of a training series.
 */
public record TimeSeriesPoint(LocalDateTime timestamp, double value) {
}

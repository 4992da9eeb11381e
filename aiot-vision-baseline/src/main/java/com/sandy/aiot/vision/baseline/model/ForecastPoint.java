package com.sandy.aiot.vision.baseline.model;

import java.time.LocalDateTime;

/**
 * One point produced by a forecast model: estimate plus upper and lower bound.
 */
public record ForecastPoint(LocalDateTime timestamp, double value, double upperValue, double lowerValue) {
}

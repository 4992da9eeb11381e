package com.sandy.aiot.vision.baseline.predict.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Spacing of forecasted points, configured with pandas style codes (s, t/m/min, h, d, w).
 */
public enum ForecastFrequency {
    SECOND("s", Duration.ofSeconds(1)),
    MINUTE("min", Duration.ofMinutes(1)),
    HOUR("h", Duration.ofHours(1)),
    DAY("d", Duration.ofDays(1)),
    WEEK("w", Duration.ofDays(7));

    private final String code;
    private final Duration step;

    ForecastFrequency(String code, Duration step) {
        this.code = code;
        this.step = step;
    }

    public static ForecastFrequency of(String code) {
        if (code == null) throw new IllegalArgumentException("Unknown frequency type: null");
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "s":
                return SECOND;
            case "t":
            case "m":
            case "min":
                return MINUTE;
            case "h":
                return HOUR;
            case "d":
                return DAY;
            case "w":
                return WEEK;
            default:
                throw new IllegalArgumentException("Unknown frequency type: " + code);
        }
    }

    public String code() {
        return code;
    }

    public Duration step() {
        return step;
    }

    public LocalDateTime plus(LocalDateTime base, long periods) {
        return base.plus(step.multipliedBy(periods));
    }
}

package com.sandy.aiot.vision.baseline.fetcher;

import com.sandy.aiot.vision.baseline.exception.UnsupportedDownSamplingException;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Aggregation resolution of the backend. Governs the fetch step, the window unit and the time format
 * of fetched rows.
 */
public enum DownSampling {
    HOUR(ChronoUnit.HOURS, 24, "yyyyMMddHH", "yyyy-MM-dd HH"),
    MINUTE(ChronoUnit.MINUTES, 24 * 60, "yyyyMMddHHmm", "yyyy-MM-dd HHmm");

    private final ChronoUnit unit;
    private final int unitsPerDay;
    private final String metricTimeFormat;
    private final DateTimeFormatter durationFormatter;

    DownSampling(ChronoUnit unit, int unitsPerDay, String metricTimeFormat, String durationFormat) {
        this.unit = unit;
        this.unitsPerDay = unitsPerDay;
        this.metricTimeFormat = metricTimeFormat;
        this.durationFormatter = DateTimeFormatter.ofPattern(durationFormat);
    }

    public static DownSampling of(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "hour":
                    return HOUR;
                case "minute":
                    return MINUTE;
                default:
                    break;
            }
        }
        throw new UnsupportedDownSamplingException(value);
    }

    public ChronoUnit unit() {
        return unit;
    }

    /**
     * Converts a retention in days to the number of units to look back.
     */
    public long periodOfDays(long days) {
        return days * unitsPerDay;
    }

    /**
     * Pattern of the time column of fetched rows, e.g. {@code yyyyMMddHH}.
     */
    public String metricTimeFormat() {
        return metricTimeFormat;
    }

    /**
     * Formats a window bound as the backend's duration string.
     */
    public DateTimeFormatter durationFormatter() {
        return durationFormatter;
    }

    /**
     * Step name sent with every query.
     */
    public String step() {
        return name();
    }
}

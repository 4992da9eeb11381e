package com.sandy.aiot.vision.baseline.result;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Granularity of query time buckets. Only hour buckets are encoded, every other step maps to 0.
 */
public enum TimeBucketStep {
    HOUR,
    MINUTE;

    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH");

    public boolean isSupported() {
        return this == HOUR;
    }

    /**
     * Encodes a timestamp as a bucket, e.g. 2024-01-01T10:15 -> 2024010110 for {@link #HOUR}.
     */
    public long bucketOf(LocalDateTime timestamp) {
        if (this == HOUR) {
            return Long.parseLong(HOUR_BUCKET.format(timestamp));
        }
        return 0;
    }
}

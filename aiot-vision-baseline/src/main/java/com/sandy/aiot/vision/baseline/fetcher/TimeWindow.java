package com.sandy.aiot.vision.baseline.fetcher;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of buckets fetched with one backend request.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public long buckets(ChronoUnit unit) {
        return unit.between(start, end) + 1;
    }

    /**
     * Splits {@code [start, end]} into contiguous windows of at most {@code maxBuckets} buckets.
     * The last window may be shorter.
     */
    public static List<TimeWindow> split(LocalDateTime start, LocalDateTime end, ChronoUnit unit, int maxBuckets) {
        if (maxBuckets <= 0) {
            throw new IllegalArgumentException("maxBuckets must be positive: " + maxBuckets);
        }
        List<TimeWindow> windows = new ArrayList<>();
        LocalDateTime cursor = start;
        while (!cursor.isAfter(end)) {
            LocalDateTime windowEnd = cursor.plus(maxBuckets - 1L, unit);
            if (windowEnd.isAfter(end)) windowEnd = end;
            windows.add(new TimeWindow(cursor, windowEnd));
            cursor = windowEnd.plus(1, unit);
        }
        return windows;
    }
}

package com.sandy.aiot.vision.baseline.calculate;

import java.util.List;

/**
 * Outcome of one baseline run.
 */
public record RunSummary(State state, List<String> savedMetrics, List<String> failedMetrics) {

    public enum State {
        DONE,
        PARTIAL_FAILURE,
        ABORTED,
        SKIPPED
    }

    public RunSummary {
        savedMetrics = List.copyOf(savedMetrics);
        failedMetrics = List.copyOf(failedMetrics);
    }

    public static RunSummary aborted() {
        return new RunSummary(State.ABORTED, List.of(), List.of());
    }

    public static RunSummary skipped() {
        return new RunSummary(State.SKIPPED, List.of(), List.of());
    }
}

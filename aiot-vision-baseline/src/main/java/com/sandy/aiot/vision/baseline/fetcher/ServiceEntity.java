package com.sandy.aiot.vision.baseline.fetcher;

/**
 * A monitored service as listed by the backend.
 */
public record ServiceEntity(String name, boolean normal) {
}

package com.sandy.aiot.vision.baseline.fetcher;

import java.util.List;

/**
 * Immutable context prepared once per run and shared read-only by all metric fetches.
 *
 * @param totalPeriod look back range in {@code downSampling} units
 */
public record FetchReadiness(List<ServiceEntity> services, long totalPeriod, DownSampling downSampling) {

    public FetchReadiness {
        services = List.copyOf(services);
    }
}

package com.sandy.aiot.vision.baseline.fetcher;

import java.util.List;
import java.util.Optional;

/**
 * Source of historical metric data.
 */
public interface Fetcher {

    /**
     * Names of the enabled metrics, in configuration order.
     */
    List<String> metricNames();

    /**
     * Prepares the per-run context: target services and look back period.
     *
     * @throws com.sandy.aiot.vision.baseline.exception.FetchException if the backend cannot be queried
     */
    FetchReadiness readyFetch();

    /**
     * Fetches the dataset of one metric for every service of the readiness context.
     *
     * @return empty when there is nothing to fetch or the backend returned no data
     * @throws com.sandy.aiot.vision.baseline.exception.FetchException if any request fails
     */
    Optional<FetchedData> fetch(String metricName, FetchReadiness readiness);
}

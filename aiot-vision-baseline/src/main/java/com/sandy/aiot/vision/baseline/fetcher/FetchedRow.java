package com.sandy.aiot.vision.baseline.fetcher;

import com.sandy.aiot.vision.baseline.model.LabelSet;

/**
 * One non-null backend sample.
 *
 * @param time  bucket time rendered with the dataset time format
 * @param label null in a single-valued dataset
 */
public record FetchedRow(String serviceName, String time, LabelSet label, double value) {
}

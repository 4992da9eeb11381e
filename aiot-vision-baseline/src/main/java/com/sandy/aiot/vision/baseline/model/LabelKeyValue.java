package com.sandy.aiot.vision.baseline.model;

import java.util.Comparator;

/**
 * One label of a multi-valued metric, e.g. {@code p=99}.
 */
public record LabelKeyValue(String key, String value) implements Comparable<LabelKeyValue> {

    private static final Comparator<LabelKeyValue> ORDER = Comparator
            .comparing(LabelKeyValue::key, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(LabelKeyValue::value, Comparator.nullsFirst(Comparator.naturalOrder()));

    @Override
    public int compareTo(LabelKeyValue o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}

package com.sandy.aiot.vision.baseline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Unordered set of labels identifying one sub-series of a multi-valued metric.
 * Pairs are kept sorted by key then value, so two sets built from the same labels in any order
 * are equal and hash alike. Serialized as a plain list of key/value pairs.
 */
public final class LabelSet {

    public static final LabelSet EMPTY = new LabelSet(List.of());

    private final List<LabelKeyValue> pairs;

    private LabelSet(List<LabelKeyValue> canonical) {
        this.pairs = canonical;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LabelSet of(Collection<LabelKeyValue> labels) {
        if (labels == null || labels.isEmpty()) return EMPTY;
        return new LabelSet(List.copyOf(new TreeSet<>(labels)));
    }

    public static LabelSet of(LabelKeyValue... labels) {
        return of(List.of(labels));
    }

    @JsonValue
    public List<LabelKeyValue> getPairs() {
        return Collections.unmodifiableList(pairs);
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelSet other)) return false;
        return pairs.equals(other.pairs);
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    @Override
    public String toString() {
        return pairs.toString();
    }
}

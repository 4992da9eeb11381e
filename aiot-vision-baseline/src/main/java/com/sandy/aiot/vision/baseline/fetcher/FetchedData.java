package com.sandy.aiot.vision.baseline.fetcher;

import com.sandy.aiot.vision.baseline.model.LabelSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Raw dataset of one metric across all services. The shape is fixed by the first non-empty response.
 * Not thread-safe; owned by the task fetching the metric.
 */
public class FetchedData {

    public enum Shape {
        SINGLE,
        MULTIPLE
    }

    private final Shape shape;
    private final String timeFormat;
    private final Set<LabelSet> labelColumns = new LinkedHashSet<>();
    private final List<FetchedRow> rows = new ArrayList<>();

    public FetchedData(Shape shape, String timeFormat) {
        this.shape = shape;
        this.timeFormat = timeFormat;
    }

    public Shape getShape() {
        return shape;
    }

    public String getTimeFormat() {
        return timeFormat;
    }

    /**
     * Label sets seen so far, in first-seen order. Always empty for a single-valued dataset.
     */
    public Set<LabelSet> getLabelColumns() {
        return Collections.unmodifiableSet(labelColumns);
    }

    public List<FetchedRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    void declareLabel(LabelSet label) {
        if (shape == Shape.MULTIPLE) labelColumns.add(label);
    }

    public void addRow(FetchedRow row) {
        if (shape == Shape.MULTIPLE) {
            labelColumns.add(row.label() == null ? LabelSet.EMPTY : row.label());
        }
        rows.add(row);
    }
}

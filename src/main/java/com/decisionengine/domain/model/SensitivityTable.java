package com.decisionengine.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Tabular result of a sensitivity sweep: one row per sample, one column per series.
 */
@Getter
@Builder
public class SensitivityTable {

    /** What the input column holds, e.g. "probability", "value", "risk-aversion". */
    private final String parameter;

    /** Dependent series, e.g. the root's branch names or "EV". */
    private final List<String> series;

    private final List<SensitivityRow> rows;

    public List<Double> column(String seriesName) {
        return rows.stream().map(row -> row.values().get(seriesName)).toList();
    }

    public List<Double> inputs() {
        return rows.stream().map(SensitivityRow::input).toList();
    }
}

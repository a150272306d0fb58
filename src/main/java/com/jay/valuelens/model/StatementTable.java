package com.jay.valuelens.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One financial statement (balance sheet, income statement or cash flow) as a
 * grid of line items × reporting periods.
 *
 * Periods are ordered most recent first. Each row holds one value per period;
 * a missing value is stored as {@code null}. Rows shorter than the period list
 * are padded with {@code null}, longer rows are truncated.
 */
public final class StatementTable {

    private static final StatementTable EMPTY = new StatementTable(List.of(), Map.of());

    private final List<String> periods;
    private final Map<String, List<Double>> rows;

    private StatementTable(List<String> periods, Map<String, List<Double>> rows) {
        this.periods = periods;
        this.rows = rows;
    }

    public static StatementTable empty() {
        return EMPTY;
    }

    public static StatementTable of(List<String> periods, Map<String, List<Double>> rows) {
        List<String> p = List.copyOf(periods);
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        rows.forEach((name, values) -> {
            List<Double> row = new ArrayList<>(p.size());
            for (int i = 0; i < p.size(); i++) {
                row.add(values != null && i < values.size() ? values.get(i) : null);
            }
            copy.put(name, Collections.unmodifiableList(row));
        });
        return new StatementTable(p, Collections.unmodifiableMap(copy));
    }

    public List<String> periods() {
        return periods;
    }

    public Set<String> lineItems() {
        return rows.keySet();
    }

    public boolean has(String lineItem) {
        return rows.containsKey(lineItem);
    }

    public Optional<List<Double>> row(String lineItem) {
        return Optional.ofNullable(rows.get(lineItem));
    }

    /** Copy restricted to the {@code count} most recent periods. */
    public StatementTable head(int count) {
        if (count >= periods.size()) return this;
        Map<String, List<Double>> cut = new LinkedHashMap<>();
        rows.forEach((name, values) -> cut.put(name, values.subList(0, count)));
        return of(periods.subList(0, count), cut);
    }

    public boolean isEmpty() {
        return periods.isEmpty() || rows.isEmpty();
    }

    @Override
    public String toString() {
        return "StatementTable" + periods + " " + rows.keySet();
    }

    /** Fluent assembly used by parsers and tests. */
    public static Builder builder(String... periods) {
        return new Builder(List.of(periods));
    }

    public static final class Builder {
        private final List<String> periods;
        private final Map<String, List<Double>> rows = new LinkedHashMap<>();

        private Builder(List<String> periods) {
            this.periods = periods;
        }

        public Builder row(String lineItem, Double... values) {
            List<Double> list = new ArrayList<>(values.length);
            Collections.addAll(list, values);
            rows.put(lineItem, list);
            return this;
        }

        public Builder row(String lineItem, List<Double> values) {
            rows.put(lineItem, new ArrayList<>(values));
            return this;
        }

        public StatementTable build() {
            return StatementTable.of(periods, rows);
        }
    }
}

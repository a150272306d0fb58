package com.jay.valuelens.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat point-in-time company attributes supplied by the data vendor
 * (price, market cap, beta, pre-computed ratios, profile strings).
 * Values are Numbers, Strings or absent.
 */
public final class InfoMap {

    private static final InfoMap EMPTY = new InfoMap(Map.of());

    private final Map<String, Object> values;

    private InfoMap(Map<String, Object> values) {
        this.values = values;
    }

    public static InfoMap empty() {
        return EMPTY;
    }

    public static InfoMap of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return new InfoMap(Collections.unmodifiableMap(copy));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /** Numeric value for the key; numeric strings are parsed, anything else is unavailable. */
    public Metric number(String key) {
        return Metric.parse(values.get(key));
    }

    /** First non-blank string among the keys, or {@code null}. */
    public String text(String... keys) {
        for (String key : keys) {
            Object v = values.get(key);
            if (v != null) {
                String s = v.toString().trim();
                if (!s.isEmpty()) return s;
            }
        }
        return null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "InfoMap" + values.keySet();
    }
}

package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.Metric;

import java.util.List;

/**
 * Reduces a row (values across periods, most recent first) or a single vendor
 * scalar to "the current value".
 */
public final class ScalarExtractor {

    private ScalarExtractor() { /* utility class */ }

    /** Most recent non-missing, finite value of the row. */
    public static Metric latest(List<Double> row) {
        if (row == null) return Metric.unavailable();
        for (Double v : row) {
            if (v != null && Double.isFinite(v)) return Metric.of(v);
        }
        return Metric.unavailable();
    }

    /** Scalar pass-through: numbers and numeric strings become a Metric, anything else is unavailable. */
    public static Metric latest(Object scalar) {
        if (scalar instanceof List<?> list) {
            for (Object v : list) {
                Metric m = latest(v);
                if (m.isAvailable()) return m;
            }
            return Metric.unavailable();
        }
        return Metric.parse(scalar);
    }
}

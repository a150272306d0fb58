package com.jay.valuelens.layer4_report;

import com.jay.valuelens.model.Metric;

import java.util.Locale;

/**
 * Display formatting for metrics. Unavailable values and blank text render as {@value #NOT_AVAILABLE}.
 */
public final class MetricFormatter {

    public static final String NOT_AVAILABLE = "N/D";

    private MetricFormatter() { /* utility class */ }

    /** 1.2345 → "1.23" */
    public static String number(Metric m) {
        return m != null && m.isAvailable() ? String.format(Locale.US, "%.2f", m.value()) : NOT_AVAILABLE;
    }

    /** 0.1234 → "12.34%" */
    public static String percent(Metric m) {
        return m != null && m.isAvailable() ? String.format(Locale.US, "%.2f%%", m.value() * 100) : NOT_AVAILABLE;
    }

    /** Value already in percentage points: 3.5 → "3.50%" */
    public static String points(Metric m) {
        return m != null && m.isAvailable() ? String.format(Locale.US, "%.2f%%", m.value()) : NOT_AVAILABLE;
    }

    /** 189.5 → "$189.50" */
    public static String currency(Metric m) {
        return m != null && m.isAvailable() ? String.format(Locale.US, "$%,.2f", m.value()) : NOT_AVAILABLE;
    }

    /** 2.5e12 → "$2,500.00B" */
    public static String billions(Metric m) {
        return m != null && m.isAvailable() ? String.format(Locale.US, "$%,.2fB", m.value() / 1e9) : NOT_AVAILABLE;
    }

    public static String text(String s) {
        return s == null || s.isBlank() ? NOT_AVAILABLE : s;
    }
}

package com.jay.valuelens.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.DoubleUnaryOperator;

/**
 * A computed figure that is either a finite number or explicitly unavailable.
 * Every derived ratio is carried as a Metric so that missing vendor data never
 * surfaces as NaN, null or an exception further down the pipeline.
 *
 * Non-finite input (NaN, ±Infinity) always collapses to {@link #unavailable()}.
 */
public record Metric(double value, boolean available) {

    private static final Metric UNAVAILABLE = new Metric(Double.NaN, false);

    public Metric {
        if (!available || !Double.isFinite(value)) {
            value = Double.NaN;
            available = false;
        }
    }

    public static Metric of(double value) {
        return Double.isFinite(value) ? new Metric(value, true) : UNAVAILABLE;
    }

    /** Null-tolerant factory for boxed vendor values. */
    public static Metric ofNullable(Double value) {
        return value == null ? UNAVAILABLE : of(value);
    }

    public static Metric unavailable() {
        return UNAVAILABLE;
    }

    /** Vendor scalar: a Number or a numeric String; anything else is unavailable. */
    public static Metric parse(Object scalar) {
        if (scalar instanceof Number n) return of(n.doubleValue());
        if (scalar instanceof String s && !s.isBlank()) {
            try {
                return of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return UNAVAILABLE;
            }
        }
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return available;
    }

    /** True only for an available value that is not exactly zero. */
    public boolean isNonZero() {
        return available && value != 0.0;
    }

    public double orElse(double fallback) {
        return available ? value : fallback;
    }

    public Metric map(DoubleUnaryOperator fn) {
        return available ? of(fn.applyAsDouble(value)) : UNAVAILABLE;
    }

    @JsonValue
    public Double toNullable() {
        return available ? value : null;
    }

    @Override
    public String toString() {
        return available ? Double.toString(value) : "unavailable";
    }
}

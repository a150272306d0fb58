package com.jay.valuelens.model;

/**
 * Outcome of building one ticker: exactly one of {@code metrics} / {@code error} is non-null.
 */
public record BuildResult(CompanyMetrics metrics, FetchError error) {

    public static BuildResult success(CompanyMetrics metrics) {
        return new BuildResult(metrics, null);
    }

    public static BuildResult failure(String ticker, String description) {
        return new BuildResult(null, new FetchError(ticker, description));
    }

    public boolean isSuccess() {
        return metrics != null;
    }
}

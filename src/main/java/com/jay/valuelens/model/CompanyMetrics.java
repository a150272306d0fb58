package com.jay.valuelens.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normalised financial-health record for one ticker.
 * Built once per analysis run by CompanyMetricsBuilder and immutable afterwards.
 * Ratios are fractions (0.12 = 12%) except {@code valueCreationSpread},
 * which is already expressed in percentage points.
 */
@Value
@Builder(toBuilder = true)
public class CompanyMetrics {

    // ── Identity ──────────────────────────────────────────────────────────────
    String ticker;
    String name;
    String country;     // null when the vendor has no value
    String industry;    // null when the vendor has no value
    String sector;      // "Unknown" when the vendor has no value

    // ── Valuation ─────────────────────────────────────────────────────────────
    Metric price;
    Metric priceToEarnings;
    Metric priceToBook;
    Metric priceToFreeCashFlow;
    Metric marketCap;

    // ── Dividends ─────────────────────────────────────────────────────────────
    Metric dividendYield;
    Metric payoutRatio;

    // ── Profitability ─────────────────────────────────────────────────────────
    Metric returnOnAssets;
    Metric returnOnEquity;
    Metric operatingMargin;
    Metric profitMargin;

    // ── Liquidity & leverage ──────────────────────────────────────────────────
    Metric currentRatio;
    Metric quickRatio;
    Metric debtToEquity;
    Metric longTermDebtToEquity;

    // ── Cost of capital ───────────────────────────────────────────────────────
    Metric costOfEquity;
    Metric costOfDebt;
    Metric effectiveTaxRate;
    Metric wacc;

    // ── Value creation ────────────────────────────────────────────────────────
    Metric roic;
    Metric valueCreationSpread;   // (ROIC − WACC) × 100

    // ── Growth (CAGR over up to 4 periods) ────────────────────────────────────
    Metric revenueGrowth;
    Metric earningsGrowth;
    Metric freeCashFlowGrowth;

    /** Positive spread: the company earns more than its cost of capital. */
    public boolean createsValue() {
        return valueCreationSpread != null && valueCreationSpread.isAvailable()
            && valueCreationSpread.value() > 0;
    }
}

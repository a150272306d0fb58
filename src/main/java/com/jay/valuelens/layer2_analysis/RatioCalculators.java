package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.Metric;
import com.jay.valuelens.model.ValuationAssumptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Cost-of-capital, return and growth formulas.
 *
 * <p>Every function is pure and works on already-extracted scalars. None of them
 * throws on missing or zero inputs: an undefined result is returned as
 * {@link Metric#unavailable()} so one ticker's gaps never abort a batch.
 *
 * <h3>Unavailability rules</h3>
 * <ul>
 *   <li>Cost of equity: never unavailable, beta defaults to 1.</li>
 *   <li>Cost of debt: 0 when there is no debt; unavailable only when debt exists
 *       but interest expense is unknown.</li>
 *   <li>Tax rate: never unavailable, falls back to the default rate.</li>
 *   <li>WACC: unavailable when total capital is zero, or when a weighted
 *       component has no rate.</li>
 *   <li>ROIC: unavailable without EBIT or with zero invested capital.</li>
 *   <li>Spread: available iff ROIC and WACC are.</li>
 * </ul>
 */
public final class RatioCalculators {

    /** Number of most recent periods considered by {@link #cagr}. */
    public static final int GROWTH_PERIODS = 4;

    private static final double DEFAULT_BETA = 1.0;

    private RatioCalculators() { /* utility class */ }

    // ── Cost of capital ───────────────────────────────────────────────────────

    /** CAPM: Rf + β·(Rm − Rf). */
    public static Metric costOfEquity(Metric beta, ValuationAssumptions assumptions) {
        double b = beta.orElse(DEFAULT_BETA);
        return Metric.of(assumptions.riskFreeRate() + b * assumptions.marketPremium());
    }

    /** Interest expense / total debt; zero debt means zero cost of debt. */
    public static Metric costOfDebt(Metric interestExpense, Metric totalDebt) {
        if (!totalDebt.isNonZero()) return Metric.of(0);
        return interestExpense.map(interest -> interest / totalDebt.value());
    }

    /** Income tax / pre-tax income, or {@code defaultRate} when that quotient is undefined. */
    public static Metric effectiveTaxRate(Metric incomeTax, Metric earningsBeforeTax, double defaultRate) {
        if (!earningsBeforeTax.isNonZero() || !incomeTax.isAvailable()) return Metric.of(defaultRate);
        return Metric.of(incomeTax.value() / earningsBeforeTax.value());
    }

    /**
     * WACC = E/(E+D)·Ke + D/(E+D)·Kd·(1−t), with E the market value of equity.
     * Unavailable E or D counts as zero.
     */
    public static Metric wacc(Metric equityValue, Metric totalDebt,
                              Metric costOfEquity, Metric costOfDebt, Metric taxRate) {
        double e = equityValue.orElse(0);
        double d = totalDebt.orElse(0);
        double total = e + d;
        if (total == 0 || !Double.isFinite(total)) return Metric.unavailable();

        double equityPart = 0;
        if (e != 0) {
            if (!costOfEquity.isAvailable()) return Metric.unavailable();
            equityPart = (e / total) * costOfEquity.value();
        }
        double debtPart = 0;
        if (d != 0) {
            if (!costOfDebt.isAvailable() || !taxRate.isAvailable()) return Metric.unavailable();
            debtPart = (d / total) * costOfDebt.value() * (1 - taxRate.value());
        }
        return Metric.of(equityPart + debtPart);
    }

    // ── Returns ───────────────────────────────────────────────────────────────

    /** EBIT·(1−t) over invested capital (equity + debt − cash). */
    public static Metric roic(Metric ebit, Metric taxRate,
                              Metric equity, Metric totalDebt, Metric cash) {
        if (!ebit.isAvailable() || !taxRate.isAvailable()) return Metric.unavailable();
        double invested = investedCapital(equity, totalDebt, cash);
        if (invested == 0) return Metric.unavailable();
        double nopat = ebit.value() * (1 - taxRate.value());
        return Metric.of(nopat / invested);
    }

    /** Equity + debt − cash; unavailable terms count as zero. */
    public static double investedCapital(Metric equity, Metric totalDebt, Metric cash) {
        return equity.orElse(0) + totalDebt.orElse(0) - cash.orElse(0);
    }

    /** (ROIC − WACC) × 100, in percentage points. */
    public static Metric valueCreationSpread(Metric roic, Metric wacc) {
        if (!roic.isAvailable() || !wacc.isAvailable()) return Metric.unavailable();
        return Metric.of((roic.value() - wacc.value()) * 100);
    }

    // ── Valuation ─────────────────────────────────────────────────────────────

    /** Price over free cash flow per share. */
    public static Metric priceToFreeCashFlow(Metric price, Metric freeCashFlow, Metric sharesOutstanding) {
        if (!price.isAvailable() || !freeCashFlow.isNonZero() || !sharesOutstanding.isNonZero()) {
            return Metric.unavailable();
        }
        double fcfPerShare = freeCashFlow.value() / sharesOutstanding.value();
        return Metric.of(price.value() / fcfPerShare);
    }

    // ── Growth ────────────────────────────────────────────────────────────────

    /**
     * Compound growth over the {@value #GROWTH_PERIODS} most recent periods of a row
     * ordered most recent first: {@code (recent / earliest)^(1/(n−1)) − 1}, where
     * {@code n} counts the non-missing values used.
     *
     * @return unavailable with fewer than two usable values, a zero earliest value,
     *         or a non-real result (negative ratio under a fractional exponent)
     */
    public static Metric cagr(List<Double> row) {
        if (row == null) return Metric.unavailable();
        List<Double> usable = new ArrayList<>(GROWTH_PERIODS);
        for (int i = 0; i < Math.min(GROWTH_PERIODS, row.size()); i++) {
            Double v = row.get(i);
            if (v != null && Double.isFinite(v)) usable.add(v);
        }
        int n = usable.size();
        if (n < 2) return Metric.unavailable();
        double recent = usable.get(0);
        double earliest = usable.get(n - 1);
        if (earliest == 0) return Metric.unavailable();
        return Metric.of(Math.pow(recent / earliest, 1.0 / (n - 1)) - 1);
    }
}

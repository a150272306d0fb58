package com.jay.valuelens.model;

/**
 * Market assumptions fed into the cost-of-capital calculators.
 * All rates are fractions: 0.0435 = 4.35%.
 *
 * @param riskFreeRate   risk-free rate, valid range [0, 0.20]
 * @param marketReturn   expected market return, valid range [0, 0.30]
 * @param defaultTaxRate tax rate used when no effective rate can be derived, valid range [0, 0.50]
 */
public record ValuationAssumptions(double riskFreeRate, double marketReturn, double defaultTaxRate) {

    public static final double DEFAULT_RISK_FREE_RATE = 0.0435;
    public static final double DEFAULT_MARKET_RETURN = 0.085;
    public static final double DEFAULT_TAX_RATE = 0.21;

    public ValuationAssumptions {
        requireInRange("riskFreeRate", riskFreeRate, 0.20);
        requireInRange("marketReturn", marketReturn, 0.30);
        requireInRange("defaultTaxRate", defaultTaxRate, 0.50);
    }

    public static ValuationAssumptions defaults() {
        return new ValuationAssumptions(DEFAULT_RISK_FREE_RATE, DEFAULT_MARKET_RETURN, DEFAULT_TAX_RATE);
    }

    /** Market risk premium (Rm − Rf). */
    public double marketPremium() {
        return marketReturn - riskFreeRate;
    }

    private static void requireInRange(String name, double value, double max) {
        if (!Double.isFinite(value) || value < 0 || value > max) {
            throw new IllegalArgumentException(
                String.format("%s must be within [0, %.2f] but was %s", name, max, value));
        }
    }
}

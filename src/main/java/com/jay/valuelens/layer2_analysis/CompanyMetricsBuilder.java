package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.BuildResult;
import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.InfoMap;
import com.jay.valuelens.model.Metric;
import com.jay.valuelens.model.RawFinancials;
import com.jay.valuelens.model.StatementTable;
import com.jay.valuelens.model.ValuationAssumptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.jay.valuelens.layer2_analysis.ScalarExtractor.latest;

/**
 * Layer 2 — Company Metrics Builder.
 * Turns one ticker's raw statements and info map into a {@link CompanyMetrics} record.
 *
 * Statement figures are looked up by concept ({@link LineItemAliases}); ratios the
 * vendor already publishes (P/E, margins, liquidity…) are taken from the info map
 * as-is. Missing inputs make the affected fields unavailable, never the record.
 * Stateless: the same input always yields an equal record.
 */
@Slf4j
@Component
public class CompanyMetricsBuilder {

    public static final String UNKNOWN_SECTOR = "Unknown";

    public BuildResult build(RawFinancials raw, ValuationAssumptions assumptions) {
        String ticker = raw.getTicker();
        try {
            CompanyMetrics metrics = doBuild(raw, assumptions);
            log.debug("Built metrics for {}: WACC={} ROIC={} spread={}",
                ticker, metrics.getWacc(), metrics.getRoic(), metrics.getValueCreationSpread());
            return BuildResult.success(metrics);
        } catch (RuntimeException e) {
            log.warn("Could not build metrics for {}: {}", ticker, e.toString());
            return BuildResult.failure(ticker, "Malformed financial data: " + e.getMessage());
        }
    }

    private CompanyMetrics doBuild(RawFinancials raw, ValuationAssumptions assumptions) {
        String ticker = raw.getTicker();
        StatementTable bs = raw.getBalanceSheet();
        StatementTable fin = raw.getIncomeStatement();
        StatementTable cf = raw.getCashFlow();
        InfoMap info = raw.getInfo();

        // ── Cost of capital ───────────────────────────────────────────────────
        Metric costOfEquity = RatioCalculators.costOfEquity(info.number("beta"), assumptions);

        Metric debt = totalDebt(bs, info);
        Metric cash = value(bs, LineItemAliases.CASH);
        Metric bookEquity = value(bs, LineItemAliases.BOOK_EQUITY);

        Metric interest = value(fin, LineItemAliases.INTEREST_EXPENSE);
        Metric ebt = value(fin, LineItemAliases.PRETAX_INCOME);
        Metric taxExpense = value(fin, LineItemAliases.INCOME_TAX);
        Metric ebit = value(fin, LineItemAliases.EBIT);

        Metric costOfDebt = RatioCalculators.costOfDebt(interest, debt);
        Metric tax = RatioCalculators.effectiveTaxRate(taxExpense, ebt, assumptions.defaultTaxRate());
        Metric marketCap = info.number("marketCap");
        Metric wacc = RatioCalculators.wacc(marketCap, debt, costOfEquity, costOfDebt, tax);

        // ── Value creation ────────────────────────────────────────────────────
        Metric roic = RatioCalculators.roic(ebit, tax, bookEquity, debt, cash);
        Metric spread = RatioCalculators.valueCreationSpread(roic, wacc);

        // ── Valuation ─────────────────────────────────────────────────────────
        Metric price = info.number("currentPrice");
        Metric fcf = value(cf, LineItemAliases.FREE_CASH_FLOW);
        Metric pfcf = RatioCalculators.priceToFreeCashFlow(price, fcf, info.number("sharesOutstanding"));

        // ── Growth ────────────────────────────────────────────────────────────
        Metric fcfGrowth = growth(cf, LineItemAliases.FREE_CASH_FLOW);
        if (!fcfGrowth.isAvailable()) fcfGrowth = growth(cf, LineItemAliases.OPERATING_CASH_FLOW);

        String sector = info.text("sector");

        return CompanyMetrics.builder()
            .ticker(ticker)
            .name(firstNonNull(info.text("longName", "shortName", "displayName"), ticker))
            .country(info.text("country", "countryCode"))
            .industry(info.text("industry", "industryKey", "industryDisp"))
            .sector(sector != null ? sector : UNKNOWN_SECTOR)
            // Valuation
            .price(price)
            .priceToEarnings(info.number("trailingPE"))
            .priceToBook(info.number("priceToBook"))
            .priceToFreeCashFlow(pfcf)
            .marketCap(marketCap)
            // Dividends
            .dividendYield(info.number("dividendYield"))
            .payoutRatio(info.number("payoutRatio"))
            // Profitability
            .returnOnAssets(info.number("returnOnAssets"))
            .returnOnEquity(info.number("returnOnEquity"))
            .operatingMargin(info.number("operatingMargins"))
            .profitMargin(info.number("profitMargins"))
            // Liquidity & leverage
            .currentRatio(info.number("currentRatio"))
            .quickRatio(info.number("quickRatio"))
            .debtToEquity(info.number("debtToEquity"))
            .longTermDebtToEquity(info.number("longTermDebtToEquity"))
            // Cost of capital
            .costOfEquity(costOfEquity)
            .costOfDebt(costOfDebt)
            .effectiveTaxRate(tax)
            .wacc(wacc)
            // Value creation
            .roic(roic)
            .valueCreationSpread(spread)
            // Growth
            .revenueGrowth(growth(fin, LineItemAliases.TOTAL_REVENUE))
            .earningsGrowth(growth(fin, LineItemAliases.NET_INCOME))
            .freeCashFlowGrowth(fcfGrowth)
            .build();
    }

    /**
     * Statement debt first; a missing or zero figure falls back to the vendor's
     * {@code totalDebt}, then to zero.
     */
    private Metric totalDebt(StatementTable bs, InfoMap info) {
        Metric fromStatement = value(bs, LineItemAliases.TOTAL_DEBT);
        if (fromStatement.isNonZero()) return fromStatement;
        Metric fromInfo = info.number("totalDebt");
        return fromInfo.isAvailable() ? fromInfo : Metric.of(0);
    }

    private static Metric value(StatementTable table, LineItemAliases concept) {
        return latest(FieldResolver.resolve(table, concept.names()));
    }

    private static Metric growth(StatementTable table, LineItemAliases concept) {
        List<Double> row = FieldResolver.resolve(table, concept.names());
        return RatioCalculators.cagr(row);
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }
}

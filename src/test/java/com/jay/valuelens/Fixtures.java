package com.jay.valuelens;

import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.InfoMap;
import com.jay.valuelens.model.Metric;
import com.jay.valuelens.model.RawFinancials;
import com.jay.valuelens.model.StatementTable;
import com.jay.valuelens.model.ValuationAssumptions;

import java.util.LinkedHashMap;
import java.util.Map;

/** Shared test data: one fully-populated company with round numbers. */
public final class Fixtures {

    /** Rf 4%, Rm 9%, default tax 21%. */
    public static final ValuationAssumptions ASSUMPTIONS = new ValuationAssumptions(0.04, 0.09, 0.21);

    private Fixtures() {}

    public static StatementTable balanceSheet() {
        return StatementTable.builder("2024-12-31", "2023-12-31")
            .row("Total Debt", 250.0, 200.0)
            .row("Cash And Cash Equivalents", 50.0, 40.0)
            .row("Common Stock Equity", 400.0, 380.0)
            .row("Total Assets", 900.0, 850.0)
            .row("Total Liabilities Net Minority Interest", 500.0, 470.0)
            .build();
    }

    public static StatementTable incomeStatement() {
        return StatementTable.builder("2024-12-31", "2023-12-31", "2022-12-31", "2021-12-31")
            .row("Interest Expense", 10.0, 8.0, 7.0, 6.0)
            .row("Pretax Income", 100.0, 90.0, 85.0, 80.0)
            .row("Income Tax Expense", 25.0, 20.0, 19.0, 18.0)
            .row("EBIT", 120.0, 100.0, 95.0, 90.0)
            .row("Total Revenue", 1000.0, 900.0, 850.0, 800.0)
            .row("Net Income", 75.0, 70.0, null, 60.0)
            .build();
    }

    public static StatementTable cashFlow() {
        return StatementTable.builder("2024-12-31", "2023-12-31")
            .row("Free Cash Flow", 100.0, 80.0)
            .row("Operating Cash Flow", 150.0, 120.0)
            .build();
    }

    public static Map<String, Object> infoValues() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("longName", "Acme Corp");
        info.put("country", "United States");
        info.put("industry", "Software");
        info.put("sector", "Technology");
        info.put("beta", 1.2);
        info.put("marketCap", 1000.0);
        info.put("currentPrice", 50.0);
        info.put("sharesOutstanding", 10.0);
        info.put("trailingPE", 20.0);
        info.put("priceToBook", 2.5);
        info.put("currentRatio", 1.4);
        info.put("returnOnEquity", 0.18);
        return info;
    }

    public static RawFinancials acme() {
        return RawFinancials.builder()
            .ticker("ACME")
            .balanceSheet(balanceSheet())
            .incomeStatement(incomeStatement())
            .cashFlow(cashFlow())
            .info(InfoMap.of(infoValues()))
            .build();
    }

    /** Minimal record for ordering/grouping tests. */
    public static CompanyMetrics record(String ticker, String sector) {
        Metric na = Metric.unavailable();
        return CompanyMetrics.builder()
            .ticker(ticker).name(ticker).sector(sector)
            .price(na).priceToEarnings(na).priceToBook(na).priceToFreeCashFlow(na).marketCap(na)
            .dividendYield(na).payoutRatio(na)
            .returnOnAssets(na).returnOnEquity(na).operatingMargin(na).profitMargin(na)
            .currentRatio(na).quickRatio(na).debtToEquity(na).longTermDebtToEquity(na)
            .costOfEquity(na).costOfDebt(na).effectiveTaxRate(na).wacc(na)
            .roic(na).valueCreationSpread(na)
            .revenueGrowth(na).earningsGrowth(na).freeCashFlowGrowth(na)
            .build();
    }
}

package com.jay.valuelens.layer2_analysis;

import java.util.List;

/**
 * Vendor line-item names per accounting concept, highest priority first.
 * Statement data from different vendors (and different years of the same vendor)
 * label the same figure differently; the builder only ever asks for a concept.
 */
public enum LineItemAliases {

    // Balance sheet
    TOTAL_DEBT("Total Debt", "Long Term Debt"),
    CASH("Cash And Cash Equivalents",
        "Cash And Cash Equivalents At Carrying Value",
        "Cash Cash Equivalents And Short Term Investments"),
    BOOK_EQUITY("Common Stock Equity", "Total Stockholder Equity"),
    TOTAL_ASSETS("Total Assets", "TotalAssets"),
    TOTAL_LIABILITIES("Total Liabilities Net Minority Interest", "Total Liabilities", "TotalLiab"),
    STOCKHOLDERS_EQUITY("Total Stockholder Equity", "Stockholders Equity", "Common Stock Equity"),

    // Income statement
    INTEREST_EXPENSE("Interest Expense"),
    PRETAX_INCOME("Ebt", "EBT", "Pretax Income"),
    INCOME_TAX("Income Tax Expense", "Tax Provision"),
    EBIT("EBIT", "Operating Income", "Earnings Before Interest and Taxes"),
    TOTAL_REVENUE("Total Revenue"),
    NET_INCOME("Net Income"),

    // Cash flow
    FREE_CASH_FLOW("Free Cash Flow"),
    OPERATING_CASH_FLOW("Operating Cash Flow");

    private final List<String> names;

    LineItemAliases(String... names) {
        this.names = List.of(names);
    }

    public List<String> names() {
        return names;
    }
}

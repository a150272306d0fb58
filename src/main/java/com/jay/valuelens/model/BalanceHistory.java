package com.jay.valuelens.model;

import java.util.List;

/**
 * Up to four most recent balance-sheet periods of assets, liabilities and equity,
 * index-aligned with {@code periods}.
 */
public record BalanceHistory(String ticker,
                             List<String> periods,
                             List<Metric> totalAssets,
                             List<Metric> totalLiabilities,
                             List<Metric> stockholdersEquity) {

    public BalanceHistory {
        periods = List.copyOf(periods);
        totalAssets = List.copyOf(totalAssets);
        totalLiabilities = List.copyOf(totalLiabilities);
        stockholdersEquity = List.copyOf(stockholdersEquity);
    }

    public static BalanceHistory empty(String ticker) {
        return new BalanceHistory(ticker, List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return periods.isEmpty();
    }
}

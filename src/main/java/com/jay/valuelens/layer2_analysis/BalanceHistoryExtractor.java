package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.BalanceHistory;
import com.jay.valuelens.model.Metric;
import com.jay.valuelens.model.StatementTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assets / liabilities / equity over the last {@value #PERIODS} balance-sheet periods,
 * for the capital-structure evolution view.
 */
@Component
public class BalanceHistoryExtractor {

    static final int PERIODS = 4;

    public BalanceHistory extract(String ticker, StatementTable balanceSheet) {
        if (balanceSheet == null || balanceSheet.isEmpty()) return BalanceHistory.empty(ticker);
        StatementTable recent = balanceSheet.head(PERIODS);
        int n = recent.periods().size();
        return new BalanceHistory(ticker,
            recent.periods(),
            series(recent, LineItemAliases.TOTAL_ASSETS, n),
            series(recent, LineItemAliases.TOTAL_LIABILITIES, n),
            series(recent, LineItemAliases.STOCKHOLDERS_EQUITY, n));
    }

    // Absent line items read as missing per period, not as the resolver's zero row.
    private static List<Metric> series(StatementTable table, LineItemAliases concept, int periods) {
        List<Double> row = FieldResolver.find(table, concept.names()).orElse(List.of());
        List<Metric> out = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            out.add(i < row.size() ? Metric.ofNullable(row.get(i)) : Metric.unavailable());
        }
        return out;
    }
}

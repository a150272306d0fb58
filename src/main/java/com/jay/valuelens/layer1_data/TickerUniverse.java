package com.jay.valuelens.layer1_data;

import com.jay.valuelens.config.AnalysisConfig;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a free-text ticker list ("hrl, AAPL msft") into the bounded working set
 * for one analysis run: upper-cased, de-duplicated, in input order.
 */
public final class TickerUniverse {

    private TickerUniverse() { /* utility class */ }

    public static List<String> parse(String text, int maxTickers) {
        if (maxTickers < 1 || maxTickers > AnalysisConfig.MAX_TICKERS_LIMIT) {
            throw new IllegalArgumentException(String.format(
                "max tickers must be within [1, %d] but was %d", AnalysisConfig.MAX_TICKERS_LIMIT, maxTickers));
        }
        if (text == null || text.isBlank()) return List.of();
        Set<String> unique = new LinkedHashSet<>();
        for (String token : text.split("[,;\\s]+")) {
            String t = token.trim().toUpperCase(Locale.ROOT);
            if (!t.isEmpty()) unique.add(t);
            if (unique.size() == maxTickers) break;
        }
        return List.copyOf(unique);
    }

    public static List<String> parse(List<String> tickers, int maxTickers) {
        return parse(tickers == null ? null : String.join(",", tickers), maxTickers);
    }
}

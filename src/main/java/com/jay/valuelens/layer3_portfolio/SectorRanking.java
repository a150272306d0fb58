package com.jay.valuelens.layer3_portfolio;

import java.util.Map;

/**
 * Fixed presentation order of industry sectors: defensive sectors first,
 * commodities last. Unrecognised sectors rank after every known one.
 */
public final class SectorRanking {

    public static final int UNKNOWN_RANK = 99;

    private static final Map<String, Integer> RANKS = Map.ofEntries(
        Map.entry("Consumer Defensive",     1),
        Map.entry("Consumer Cyclical",      2),
        Map.entry("Healthcare",             3),
        Map.entry("Technology",             4),
        Map.entry("Financial Services",     5),
        Map.entry("Industrials",            6),
        Map.entry("Communication Services", 7),
        Map.entry("Energy",                 8),
        Map.entry("Real Estate",            9),
        Map.entry("Utilities",             10),
        Map.entry("Basic Materials",       11)
    );

    private SectorRanking() { /* utility class */ }

    public static int rankOf(String sector) {
        if (sector == null) return UNKNOWN_RANK;
        return RANKS.getOrDefault(sector, UNKNOWN_RANK);
    }

    public static Map<String, Integer> knownRanks() {
        return RANKS;
    }
}

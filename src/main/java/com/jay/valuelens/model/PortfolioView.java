package com.jay.valuelens.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Records sorted by (sector rank, sector, ticker). Sector grouping is derived
 * from that order and never owns the records.
 */
public final class PortfolioView {

    private static final PortfolioView EMPTY = new PortfolioView(List.of(), List.of());

    private final List<CompanyMetrics> records;
    private final List<SectorGroup> sectors;

    private PortfolioView(List<CompanyMetrics> records, List<SectorGroup> sectors) {
        this.records = records;
        this.sectors = sectors;
    }

    public static PortfolioView empty() {
        return EMPTY;
    }

    /**
     * @param sorted records already in view order
     * @param rankOf sector rank lookup used to label the groups
     */
    public static PortfolioView of(List<CompanyMetrics> sorted, ToIntFunction<String> rankOf) {
        if (sorted.isEmpty()) return EMPTY;
        Map<String, List<CompanyMetrics>> bySector = new LinkedHashMap<>();
        for (CompanyMetrics m : sorted) {
            bySector.computeIfAbsent(m.getSector(), k -> new ArrayList<>()).add(m);
        }
        List<SectorGroup> groups = new ArrayList<>(bySector.size());
        bySector.forEach((sector, list) -> groups.add(new SectorGroup(sector, rankOf.applyAsInt(sector), list)));
        return new PortfolioView(List.copyOf(sorted), List.copyOf(groups));
    }

    public List<CompanyMetrics> records() {
        return records;
    }

    public List<SectorGroup> sectors() {
        return sectors;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}

package com.jay.valuelens.layer3_portfolio;

import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.PortfolioView;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Layer 3 — Portfolio Aggregator.
 * Orders per-ticker records by (sector rank, sector, ticker) and windows sector
 * groups for paginated display. Works on any subset of a batch, including none.
 */
@Component
public class PortfolioAggregator {

    public static final int DEFAULT_CHUNK_SIZE = 10;

    static final Comparator<CompanyMetrics> VIEW_ORDER =
        Comparator.comparingInt((CompanyMetrics m) -> SectorRanking.rankOf(m.getSector()))
            .thenComparing(CompanyMetrics::getSector, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CompanyMetrics::getTicker, Comparator.nullsLast(Comparator.naturalOrder()));

    public PortfolioView aggregate(List<CompanyMetrics> records) {
        if (records == null || records.isEmpty()) return PortfolioView.empty();
        List<CompanyMetrics> sorted = new ArrayList<>(records);
        sorted.sort(VIEW_ORDER); // List.sort is stable
        return PortfolioView.of(sorted, SectorRanking::rankOf);
    }

    /** Consecutive windows of at most {@code size} records, input order preserved. */
    public static <T> List<List<T>> chunk(List<T> records, int size) {
        if (size < 1) throw new IllegalArgumentException("Chunk size must be positive, was " + size);
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < records.size(); i += size) {
            chunks.add(List.copyOf(records.subList(i, Math.min(i + size, records.size()))));
        }
        return chunks;
    }

    public static <T> List<List<T>> chunk(List<T> records) {
        return chunk(records, DEFAULT_CHUNK_SIZE);
    }
}

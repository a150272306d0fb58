package com.jay.valuelens.layer3_portfolio;

import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.PortfolioView;
import com.jay.valuelens.model.SectorGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.jay.valuelens.Fixtures.record;
import static org.junit.jupiter.api.Assertions.*;

class PortfolioAggregatorTest {

    private final PortfolioAggregator aggregator = new PortfolioAggregator();

    private static List<String> tickers(List<CompanyMetrics> records) {
        return records.stream().map(CompanyMetrics::getTicker).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("sector ordering")
    class Ordering {

        @Test
        @DisplayName("rank first, ticker breaks ties")
        void rankThenTicker() {
            PortfolioView view = aggregator.aggregate(List.of(
                record("XOM", "Energy"),
                record("ZZZ", "Unknown"),
                record("MSFT", "Technology"),
                record("CVX", "Energy"),
                record("AAPL", "Technology")));

            assertEquals(List.of("AAPL", "MSFT", "CVX", "XOM", "ZZZ"), tickers(view.records()));
            assertEquals(List.of("Technology", "Energy", "Unknown"),
                view.sectors().stream().map(SectorGroup::sector).collect(Collectors.toList()));
            assertEquals(List.of(4, 8, SectorRanking.UNKNOWN_RANK),
                view.sectors().stream().map(SectorGroup::rank).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("unranked sectors share the last rank and sort by name")
        void unrankedByName() {
            PortfolioView view = aggregator.aggregate(List.of(
                record("B", "Unknown"),
                record("A", "Space Mining"),
                record("C", "Healthcare")));
            assertEquals(List.of("C", "A", "B"), tickers(view.records()));
        }

        @Test
        void inputListIsNotReordered() {
            List<CompanyMetrics> input = new ArrayList<>(List.of(record("XOM", "Energy"), record("KO", "Consumer Defensive")));
            aggregator.aggregate(input);
            assertEquals(List.of("XOM", "KO"), tickers(input));
        }

        @Test
        void emptyInputGivesEmptyView() {
            assertTrue(aggregator.aggregate(List.of()).isEmpty());
            assertTrue(aggregator.aggregate(null).sectors().isEmpty());
        }

        @Test
        void groupsCoverEveryRecordOnce() {
            PortfolioView view = aggregator.aggregate(List.of(
                record("KO", "Consumer Defensive"), record("CLX", "Consumer Defensive"), record("JNJ", "Healthcare")));
            assertEquals(view.size(), view.sectors().stream().mapToInt(SectorGroup::size).sum());
            assertEquals(List.of("CLX", "KO"), tickers(view.sectors().get(0).records()));
        }
    }

    @Nested
    @DisplayName("chunking")
    class Chunking {

        @Test
        @DisplayName("23 records in windows of 10 → 10, 10, 3")
        void windows() {
            List<Integer> items = IntStream.range(0, 23).boxed().collect(Collectors.toList());
            List<List<Integer>> chunks = PortfolioAggregator.chunk(items, 10);
            assertEquals(3, chunks.size());
            assertEquals(10, chunks.get(0).size());
            assertEquals(10, chunks.get(1).size());
            assertEquals(List.of(20, 21, 22), chunks.get(2));
            assertEquals(items, chunks.stream().flatMap(List::stream).collect(Collectors.toList()));
        }

        @Test
        void defaultWindowIsTen() {
            List<Integer> items = IntStream.range(0, 10).boxed().collect(Collectors.toList());
            assertEquals(1, PortfolioAggregator.chunk(items).size());
        }

        @Test
        void emptyInputHasNoChunks() {
            assertTrue(PortfolioAggregator.chunk(List.of(), 5).isEmpty());
        }

        @Test
        void nonPositiveSizeRejected() {
            assertThrows(IllegalArgumentException.class, () -> PortfolioAggregator.chunk(List.of(1), 0));
            assertThrows(IllegalArgumentException.class, () -> PortfolioAggregator.chunk(List.of(1), -3));
        }
    }
}

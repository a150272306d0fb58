package com.jay.valuelens.layer4_report;

import com.jay.valuelens.Fixtures;
import com.jay.valuelens.layer2_analysis.CompanyMetricsBuilder;
import com.jay.valuelens.layer3_portfolio.PortfolioAggregator;
import com.jay.valuelens.model.AnalysisReport;
import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.FetchError;
import com.jay.valuelens.model.Metric;
import com.jay.valuelens.model.PortfolioView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioReportGeneratorTest {

    private final PortfolioReportGenerator generator = new PortfolioReportGenerator();

    private static AnalysisReport report(List<CompanyMetrics> records, List<FetchError> errors, List<String> requested) {
        PortfolioView view = new PortfolioAggregator().aggregate(records);
        return AnalysisReport.builder()
            .requestedTickers(requested)
            .view(view)
            .errors(errors)
            .balanceHistories(Map.of())
            .assumptions(Fixtures.ASSUMPTIONS)
            .analysedAt(LocalDateTime.of(2024, 3, 1, 9, 30))
            .build();
    }

    private static CompanyMetrics acme() {
        return new CompanyMetricsBuilder().build(Fixtures.acme(), Fixtures.ASSUMPTIONS).metrics();
    }

    @Test
    @DisplayName("sector blocks, verdicts and errors are all rendered")
    void fullReport() {
        String text = generator.generate(report(
            List.of(acme(), Fixtures.record("XOM", "Energy")),
            List.of(new FetchError("BAD", "No data found for BAD")),
            List.of("ACME", "XOM", "BAD")), 10);

        assertTrue(text.contains("01-Mar-2024 09:30"));
        assertTrue(text.contains("Rf 4.00%  |  Rm 9.00%  |  Tax 21.00%"));
        assertTrue(text.contains("3 requested, 2 analysed, 1 failed"));
        assertTrue(text.indexOf("SECTOR: Technology") < text.indexOf("SECTOR: Energy"));
        assertTrue(text.contains("ACME     ✅ Creates value (ROIC > WACC, spread 6.40%)"));
        assertTrue(text.contains("XOM      Insufficient data to compare ROIC/WACC"));
        assertTrue(text.contains("TICKERS WITH ERRORS"));
        assertTrue(text.contains("BAD      No data found for BAD"));
        assertFalse(text.contains("No usable data"));
        assertTrue(text.contains("N/D"), "unavailable cells");
    }

    @Test
    @DisplayName("large sectors are split into numbered blocks")
    void chunkedSector() {
        List<CompanyMetrics> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) records.add(Fixtures.record("T" + i, "Utilities"));
        String text = generator.generate(report(records, List.of(), List.of()), 2);
        assertTrue(text.contains("Block 1"));
        assertTrue(text.contains("Block 3"));
        assertFalse(text.contains("Block 4"));
    }

    @Test
    void nothingUsable() {
        String text = generator.generate(report(List.of(),
            List.of(new FetchError("BAD", "boom")), List.of("BAD")), 10);
        assertTrue(text.contains("⛔ No usable data"));
        assertFalse(text.contains("VALUE CREATION"));
        assertTrue(text.contains("BAD"));
    }

    @Test
    void destroysValueVerdict() {
        CompanyMetrics m = acme().toBuilder().valueCreationSpread(Metric.of(-1.5)).build();
        assertEquals("❌ Destroys value (ROIC ≤ WACC, spread -1.50%)", generator.verdict(m));
    }
}

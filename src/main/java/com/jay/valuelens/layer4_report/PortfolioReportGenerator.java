package com.jay.valuelens.layer4_report;

import com.jay.valuelens.layer3_portfolio.PortfolioAggregator;
import com.jay.valuelens.model.AnalysisReport;
import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.FetchError;
import com.jay.valuelens.model.SectorGroup;
import com.jay.valuelens.model.ValuationAssumptions;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

import static com.jay.valuelens.layer4_report.MetricFormatter.billions;
import static com.jay.valuelens.layer4_report.MetricFormatter.currency;
import static com.jay.valuelens.layer4_report.MetricFormatter.number;
import static com.jay.valuelens.layer4_report.MetricFormatter.percent;
import static com.jay.valuelens.layer4_report.MetricFormatter.points;
import static com.jay.valuelens.layer4_report.MetricFormatter.text;

/**
 * Layer 4 — Portfolio Report Generator.
 * Plain-text rendering of an analysis run: one block per sector (split into
 * windows of the configured size), a value-creation verdict per company,
 * and the list of tickers that failed.
 */
@Component
public class PortfolioReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter FMT = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm");
    private static final String ROW_FORMAT =
        "%-8s %-24s %10s %8s %8s %8s %8s %8s %9s %9s %9s%n";

    public String generate(AnalysisReport report, int chunkSize) {
        StringBuilder sb = new StringBuilder();
        String timestamp = report.getAnalysedAt() != null ? report.getAnalysedAt().format(FMT) : "NOW";
        sb.append("📊 FINANCIAL HEALTH REPORT  —  ").append(timestamp).append("\n");
        sb.append(DIVIDER).append("\n");
        ValuationAssumptions a = report.getAssumptions();
        if (a != null) {
            sb.append(String.format("ASSUMPTIONS       :  Rf %.2f%%  |  Rm %.2f%%  |  Tax %.2f%%%n",
                a.riskFreeRate() * 100, a.marketReturn() * 100, a.defaultTaxRate() * 100));
        }
        sb.append(String.format("TICKERS           :  %d requested, %d analysed, %d failed%n",
            report.getRequestedTickers().size(), report.getRecords().size(), report.getErrors().size()));
        sb.append(DIVIDER).append("\n");

        if (report.isNoUsableRecords()) {
            sb.append("⛔ No usable data could be obtained for the requested tickers.\n");
        }

        for (SectorGroup group : report.getSectors()) {
            sb.append(String.format("%n▶ SECTOR: %s (%d companies)%n", group.sector(), group.size()));
            List<List<CompanyMetrics>> chunks = PortfolioAggregator.chunk(group.records(), chunkSize);
            for (int i = 0; i < chunks.size(); i++) {
                if (chunks.size() > 1) sb.append(String.format("  Block %d%n", i + 1));
                sb.append(String.format(ROW_FORMAT, "TICKER", "NAME", "PRICE", "P/E", "P/FCF",
                    "ROE", "WACC", "ROIC", "SPREAD", "REV CAGR", "MKT CAP"));
                for (CompanyMetrics m : chunks.get(i)) {
                    sb.append(String.format(ROW_FORMAT, m.getTicker(), abbreviate(m.getName(), 24),
                        currency(m.getPrice()), number(m.getPriceToEarnings()), number(m.getPriceToFreeCashFlow()),
                        percent(m.getReturnOnEquity()), percent(m.getWacc()), percent(m.getRoic()),
                        points(m.getValueCreationSpread()), percent(m.getRevenueGrowth()),
                        billions(m.getMarketCap())));
                }
            }
        }

        if (!report.getRecords().isEmpty()) {
            sb.append("\n").append(DIVIDER).append("\n");
            sb.append("VALUE CREATION (ROIC vs WACC)\n");
            for (CompanyMetrics m : report.getRecords()) {
                sb.append(String.format("   • %-8s %s%n", m.getTicker(), verdict(m)));
            }
        }

        if (!report.getErrors().isEmpty()) {
            sb.append("\n").append(DIVIDER).append("\n");
            sb.append("🚫 TICKERS WITH ERRORS\n");
            for (FetchError e : report.getErrors()) {
                sb.append(String.format("   • %-8s %s%n", e.ticker(), text(e.description())));
            }
        }
        sb.append("─────────────────────────────────────────────────────────\n");
        return sb.toString();
    }

    /** One-line verdict for a company's spread. */
    public String verdict(CompanyMetrics m) {
        if (!m.getValueCreationSpread().isAvailable()) {
            return "Insufficient data to compare ROIC/WACC";
        }
        String spread = points(m.getValueCreationSpread());
        return m.createsValue()
            ? "✅ Creates value (ROIC > WACC, spread " + spread + ")"
            : "❌ Destroys value (ROIC ≤ WACC, spread " + spread + ")";
    }

    private static String abbreviate(String s, int max) {
        String t = text(s);
        return t.length() <= max ? t : t.substring(0, max - 1) + "…";
    }
}

package com.jay.valuelens.controller;

import com.jay.valuelens.config.AnalysisConfig;
import com.jay.valuelens.layer3_portfolio.PortfolioAggregator;
import com.jay.valuelens.layer3_portfolio.PortfolioAnalysisService;
import com.jay.valuelens.layer3_portfolio.SectorRanking;
import com.jay.valuelens.layer4_report.PortfolioReportGenerator;
import com.jay.valuelens.model.AnalysisReport;
import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.SectorGroup;
import com.jay.valuelens.model.ValuationAssumptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — comparative financial-health analysis.
 *
 * Endpoints:
 *   GET /api/portfolio          — full analysis (records in sector order, errors, balance history)
 *   GET /api/portfolio/sectors  — sector groups split into display windows
 *   GET /api/portfolio/report   — plain-text report
 *   GET /api/config             — active assumptions and limits
 *
 * All analysis endpoints accept {@code tickers} (comma separated, defaults to the
 * configured list), {@code max}, and optional rate overrides as fractions
 * ({@code riskFreeRate}, {@code marketReturn}, {@code taxRate}).
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioAnalysisService analysisService;
    private final PortfolioReportGenerator reportGenerator;
    private final AnalysisConfig config;

    // ── GET /api/portfolio ─────────────────────────────────────────────────────

    @GetMapping("/portfolio")
    public ResponseEntity<AnalysisReport> portfolio(
            @RequestParam(required = false) String tickers,
            @RequestParam(required = false) Integer max,
            @RequestParam(required = false) Double riskFreeRate,
            @RequestParam(required = false) Double marketReturn,
            @RequestParam(required = false) Double taxRate) {
        return ResponseEntity.ok(run(tickers, max, riskFreeRate, marketReturn, taxRate));
    }

    // ── GET /api/portfolio/sectors ─────────────────────────────────────────────

    @GetMapping("/portfolio/sectors")
    public ResponseEntity<List<Map<String, Object>>> sectors(
            @RequestParam(required = false) String tickers,
            @RequestParam(required = false) Integer max,
            @RequestParam(required = false) Integer chunk) {
        int size = chunk != null ? chunk : config.display().getChunkSize();
        if (size < 1) throw new IllegalArgumentException("chunk must be positive, was " + size);
        AnalysisReport report = run(tickers, max, null, null, null);
        List<Map<String, Object>> body = report.getSectors().stream()
            .map(g -> sectorBody(g, size))
            .toList();
        return ResponseEntity.ok(body);
    }

    // ── GET /api/portfolio/report ──────────────────────────────────────────────

    @GetMapping(value = "/portfolio/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(
            @RequestParam(required = false) String tickers,
            @RequestParam(required = false) Integer max) {
        AnalysisReport report = run(tickers, max, null, null, null);
        return ResponseEntity.ok(reportGenerator.generate(report, config.display().getChunkSize()));
    }

    // ── GET /api/config ────────────────────────────────────────────────────────

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> configSummary() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("assumptions", config.assumptions());
        body.put("maxTickers", config.universe().getMaxTickers());
        body.put("maxTickersLimit", AnalysisConfig.MAX_TICKERS_LIMIT);
        body.put("defaultTickers", config.universe().getDefaultTickers());
        body.put("chunkSize", config.display().getChunkSize());
        body.put("sectorRanks", SectorRanking.knownRanks());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private AnalysisReport run(String tickers, Integer max,
                               Double riskFreeRate, Double marketReturn, Double taxRate) {
        String list = tickers != null && !tickers.isBlank()
            ? tickers : String.join(",", config.universe().getDefaultTickers());
        int limit = max != null ? max : config.universe().getMaxTickers();
        ValuationAssumptions base = config.assumptions();
        ValuationAssumptions assumptions = new ValuationAssumptions(
            riskFreeRate != null ? riskFreeRate : base.riskFreeRate(),
            marketReturn != null ? marketReturn : base.marketReturn(),
            taxRate != null ? taxRate : base.defaultTaxRate());
        return analysisService.analyse(list, limit, assumptions);
    }

    private static Map<String, Object> sectorBody(SectorGroup group, int size) {
        List<List<CompanyMetrics>> chunks = PortfolioAggregator.chunk(group.records(), size);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sector", group.sector());
        m.put("rank", group.rank());
        m.put("count", group.size());
        m.put("chunks", chunks);
        return m;
    }
}

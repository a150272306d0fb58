package com.jay.valuelens.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.valuelens.model.ValuationAssumptions;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.List;

/**
 * Loads and exposes all configuration from config.yaml.
 * Values are read once at startup. A missing file or an out-of-range value
 * keeps the built-in defaults for the affected section.
 */
@Slf4j
@Component
public class AnalysisConfig {

    public static final int MAX_TICKERS_LIMIT = 100;

    @Value("${analysis.config-file:config.yaml}")
    private String configFile = "config.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Valuation valuation = new Valuation();
    private Universe universe = new Universe();
    private Display display = new Display();
    private Fetch fetch = new Fetch();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            if (root.getValuation() != null) applyValuation(root.getValuation());
            if (root.getUniverse() != null) applyUniverse(root.getUniverse());
            if (root.getDisplay() != null) applyDisplay(root.getDisplay());
            if (root.getFetch() != null) this.fetch = root.getFetch();
            log.info("AnalysisConfig loaded from '{}'. Rf={} Rm={} Tc={} maxTickers={}",
                configFile, valuation.getRiskFreeRate(), valuation.getMarketReturn(),
                valuation.getDefaultTaxRate(), universe.getMaxTickers());
        } catch (Exception e) {
            log.error("Failed to load {} — using defaults: {}", configFile, e.getMessage());
        }
    }

    private void applyValuation(Valuation v) {
        try {
            v.toAssumptions();
            this.valuation = v;
        } catch (IllegalArgumentException e) {
            log.error("Invalid valuation section, keeping defaults: {}", e.getMessage());
        }
    }

    private void applyUniverse(Universe u) {
        if (u.getMaxTickers() < 1 || u.getMaxTickers() > MAX_TICKERS_LIMIT) {
            log.error("universe.max_tickers={} outside [1, {}], keeping {}",
                u.getMaxTickers(), MAX_TICKERS_LIMIT, universe.getMaxTickers());
            u.setMaxTickers(universe.getMaxTickers());
        }
        if (u.getDefaultTickers() == null) u.setDefaultTickers(universe.getDefaultTickers());
        this.universe = u;
    }

    private void applyDisplay(Display d) {
        if (d.getChunkSize() < 1) {
            log.error("display.chunk_size={} must be positive, keeping {}", d.getChunkSize(), display.getChunkSize());
            return;
        }
        this.display = d;
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Valuation valuation()              { return valuation; }
    public Universe universe()                { return universe; }
    public Display display()                  { return display; }
    public Fetch fetch()                      { return fetch; }
    public ValuationAssumptions assumptions() { return valuation.toAssumptions(); }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Valuation valuation;
        private Universe universe;
        private Display display;
        private Fetch fetch;
    }

    @Data public static class Valuation {
        private double riskFreeRate = ValuationAssumptions.DEFAULT_RISK_FREE_RATE;
        private double marketReturn = ValuationAssumptions.DEFAULT_MARKET_RETURN;
        private double defaultTaxRate = ValuationAssumptions.DEFAULT_TAX_RATE;

        public ValuationAssumptions toAssumptions() {
            return new ValuationAssumptions(riskFreeRate, marketReturn, defaultTaxRate);
        }
    }

    @Data public static class Universe {
        private int maxTickers = 50;
        private List<String> defaultTickers =
            List.of("HRL", "AAPL", "MSFT", "ABT", "O", "XOM", "KO", "JNJ", "CLX", "CHD", "CB", "DDOG");
    }

    @Data public static class Display {
        private int chunkSize = 10;
    }

    @Data public static class Fetch {
        private int parallelism = 1;
        private int maxConcurrentRequests = 5;
        private long requestDelayMs = 1000;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 15;
        private int tickerTimeoutSeconds = 60;
    }
}

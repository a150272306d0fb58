package com.jay.valuelens.layer3_portfolio;

import com.jay.valuelens.config.AnalysisConfig;
import com.jay.valuelens.layer1_data.DataFetchException;
import com.jay.valuelens.layer1_data.FinancialDataSource;
import com.jay.valuelens.layer1_data.TickerUniverse;
import com.jay.valuelens.layer2_analysis.BalanceHistoryExtractor;
import com.jay.valuelens.layer2_analysis.CompanyMetricsBuilder;
import com.jay.valuelens.model.AnalysisReport;
import com.jay.valuelens.model.BalanceHistory;
import com.jay.valuelens.model.BuildResult;
import com.jay.valuelens.model.CompanyMetrics;
import com.jay.valuelens.model.FetchError;
import com.jay.valuelens.model.RawFinancials;
import com.jay.valuelens.model.ValuationAssumptions;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one comparative analysis: ticker list → fetch → per-ticker metrics → sector-ordered view.
 *
 * Each ticker is independent. A fetch or build failure is recorded as a
 * {@link FetchError} and the batch carries on with the remaining tickers.
 * Used by GET /api/portfolio and its report/sector variants.
 */
@Slf4j
@Service
public class PortfolioAnalysisService {

    private final FinancialDataSource dataSource;
    private final CompanyMetricsBuilder metricsBuilder;
    private final BalanceHistoryExtractor historyExtractor;
    private final PortfolioAggregator aggregator;
    private final AnalysisConfig config;

    private final ExecutorService executor;

    public PortfolioAnalysisService(FinancialDataSource dataSource,
                                    CompanyMetricsBuilder metricsBuilder,
                                    BalanceHistoryExtractor historyExtractor,
                                    PortfolioAggregator aggregator,
                                    AnalysisConfig config) {
        this.dataSource = dataSource;
        this.metricsBuilder = metricsBuilder;
        this.historyExtractor = historyExtractor;
        this.aggregator = aggregator;
        this.config = config;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.fetch().getParallelism()));
    }

    public AnalysisReport analyse(String tickerText) {
        return analyse(tickerText, config.universe().getMaxTickers(), config.assumptions());
    }

    public AnalysisReport analyse(String tickerText, int maxTickers, ValuationAssumptions assumptions) {
        List<String> tickers = TickerUniverse.parse(tickerText, maxTickers);
        log.info("Portfolio analysis requested for {} tickers (Rf={} Rm={} Tc={})", tickers.size(),
            assumptions.riskFreeRate(), assumptions.marketReturn(), assumptions.defaultTaxRate());

        // Submit everything first, then collect in request order
        List<Future<TickerOutcome>> futures = new ArrayList<>(tickers.size());
        for (String ticker : tickers) {
            futures.add(executor.submit(() -> process(ticker, assumptions)));
        }

        List<CompanyMetrics> records = new ArrayList<>();
        List<FetchError> errors = new ArrayList<>();
        Map<String, BalanceHistory> histories = new LinkedHashMap<>();
        long timeout = config.fetch().getTickerTimeoutSeconds();
        for (int i = 0; i < tickers.size(); i++) {
            String ticker = tickers.get(i);
            TickerOutcome outcome = await(ticker, futures.get(i), timeout);
            if (outcome.result().isSuccess()) {
                records.add(outcome.result().metrics());
                histories.put(ticker, outcome.history());
            } else {
                errors.add(outcome.result().error());
            }
        }

        if (records.isEmpty()) {
            log.warn("No usable records for {} requested tickers ({} errors)", tickers.size(), errors.size());
        } else {
            log.info("Portfolio analysis complete: {} records, {} errors", records.size(), errors.size());
        }

        return AnalysisReport.builder()
            .requestedTickers(tickers)
            .view(aggregator.aggregate(records))
            .errors(List.copyOf(errors))
            .balanceHistories(histories)
            .assumptions(assumptions)
            .analysedAt(LocalDateTime.now())
            .build();
    }

    private TickerOutcome process(String ticker, ValuationAssumptions assumptions) {
        try {
            log.debug("Processing {}", ticker);
            RawFinancials raw = dataSource.fetch(ticker);
            BuildResult result = metricsBuilder.build(raw, assumptions);
            BalanceHistory history = result.isSuccess()
                ? historyExtractor.extract(ticker, raw.getBalanceSheet())
                : BalanceHistory.empty(ticker);
            return new TickerOutcome(result, history);
        } catch (DataFetchException e) {
            log.warn("Fetch failed for {}: {}", ticker, e.getMessage());
            return failed(ticker, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure for {}: {}", ticker, e.toString());
            return failed(ticker, e.toString());
        }
    }

    private TickerOutcome await(String ticker, Future<TickerOutcome> future, long timeoutSeconds) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Timed out after {}s waiting for {}", timeoutSeconds, ticker);
            return failed(ticker, "Timed out after " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            return failed(ticker, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(ticker, "Analysis interrupted");
        }
    }

    private static TickerOutcome failed(String ticker, String description) {
        return new TickerOutcome(BuildResult.failure(ticker, description), BalanceHistory.empty(ticker));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private record TickerOutcome(BuildResult result, BalanceHistory history) {}
}

package com.jay.valuelens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Result of one batch run: the sorted view, per-ticker fetch errors and
 * balance histories. {@code noUsableRecords} is set when no ticker produced a record.
 */
@Value
@Builder
public class AnalysisReport {
    List<String> requestedTickers;
    @JsonIgnore PortfolioView view;
    List<FetchError> errors;
    Map<String, BalanceHistory> balanceHistories;
    ValuationAssumptions assumptions;
    LocalDateTime analysedAt;

    public List<CompanyMetrics> getRecords() {
        return view.records();
    }

    public List<SectorGroup> getSectors() {
        return view.sectors();
    }

    public boolean isNoUsableRecords() {
        return view.isEmpty();
    }
}

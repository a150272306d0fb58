package com.jay.valuelens.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the data source returned for one ticker.
 * Any table may be empty and the info map may miss keys; neither is a failure.
 */
@Value
@Builder(toBuilder = true)
public class RawFinancials {
    String ticker;
    @Builder.Default StatementTable balanceSheet = StatementTable.empty();
    @Builder.Default StatementTable incomeStatement = StatementTable.empty();
    @Builder.Default StatementTable cashFlow = StatementTable.empty();
    @Builder.Default InfoMap info = InfoMap.empty();
}

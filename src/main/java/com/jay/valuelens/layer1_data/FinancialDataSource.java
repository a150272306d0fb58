package com.jay.valuelens.layer1_data;

import com.jay.valuelens.model.RawFinancials;

/**
 * Supplies raw statements and the info map for one ticker.
 */
public interface FinancialDataSource {

    /**
     * @return the ticker's statements (possibly empty tables) and info map
     * @throws DataFetchException when nothing usable could be retrieved
     */
    RawFinancials fetch(String ticker);
}

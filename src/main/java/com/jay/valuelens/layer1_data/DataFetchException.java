package com.jay.valuelens.layer1_data;

/**
 * Raised by a {@link FinancialDataSource} when no usable data could be obtained
 * for a ticker at all. A response that is present but empty is not a failure.
 */
public class DataFetchException extends RuntimeException {

    private final String ticker;

    public DataFetchException(String ticker, String message) {
        super(message);
        this.ticker = ticker;
    }

    public DataFetchException(String ticker, String message, Throwable cause) {
        super(message, cause);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}

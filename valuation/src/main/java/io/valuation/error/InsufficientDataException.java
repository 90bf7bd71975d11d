package io.valuation.error;

import java.util.List;

/**
 * No comparable ticker produced a volatility, so there is nothing to average.
 */
public class InsufficientDataException extends ValuationException {
    private final List<String> failedTickers;

    public InsufficientDataException(String message, List<String> failedTickers) {
        super(message);
        this.failedTickers = List.copyOf(failedTickers);
    }

    public List<String> failedTickers() { return failedTickers; }
}

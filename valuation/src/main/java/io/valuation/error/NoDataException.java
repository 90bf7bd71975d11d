package io.valuation.error;

/** A market-data fetch returned no usable observations. */
public class NoDataException extends ValuationException {
    public NoDataException(String message) {
        super(message);
    }
}

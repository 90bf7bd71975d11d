package io.valuation.error;

/** Malformed or empty input series, or an unsupported sampling frequency. */
public class DataException extends ValuationException {
    public DataException(String message) {
        super(message);
    }
}

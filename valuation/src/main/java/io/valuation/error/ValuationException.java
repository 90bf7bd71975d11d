package io.valuation.error;

/**
 * Root of the valuation failure taxonomy. Everything the core raises on purpose extends this.
 */
public class ValuationException extends RuntimeException {
    public ValuationException(String message) {
        super(message);
    }

    public ValuationException(String message, Throwable cause) {
        super(message, cause);
    }
}

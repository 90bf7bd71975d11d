package io.valuation.error;

/** Pricing inputs outside the model's domain (non-positive maturity or volatility). */
public class DomainException extends ValuationException {
    public DomainException(String message) {
        super(message);
    }
}

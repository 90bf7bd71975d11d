package io.valuation.orchestrator;

import java.time.LocalDate;
import java.util.Objects;

/** Terms of the grant being valued. */
public record OptionParameters(double spot,
                               double strike,
                               LocalDate grantDate,
                               LocalDate valuationDate,
                               LocalDate expirationDate,
                               LocalDate vestingEndDate) {
    public OptionParameters {
        Objects.requireNonNull(grantDate, "grantDate");
        Objects.requireNonNull(valuationDate, "valuationDate");
        Objects.requireNonNull(expirationDate, "expirationDate");
        Objects.requireNonNull(vestingEndDate, "vestingEndDate");
    }
}

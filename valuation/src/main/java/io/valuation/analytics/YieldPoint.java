package io.valuation.analytics;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Observed yield (percent) of one reference instrument. A missing point keeps the reason its fetch
 * failed, so it still shows up in the report.
 */
public record YieldPoint(int maturityYears, String label, OptionalDouble yieldPercent, String error) {
    public YieldPoint {
        if (maturityYears < 1) throw new IllegalArgumentException("maturity must be >= 1 year, was " + maturityYears);
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(yieldPercent, "yieldPercent");
        error = error == null ? "" : error;
    }

    public static YieldPoint present(int maturityYears, String label, double yieldPercent) {
        return new YieldPoint(maturityYears, label, OptionalDouble.of(yieldPercent), "");
    }

    public static YieldPoint present(int maturityYears, double yieldPercent) {
        return present(maturityYears, maturityYears + "-year", yieldPercent);
    }

    public static YieldPoint missing(int maturityYears, String label, String reason) {
        return new YieldPoint(maturityYears, label, OptionalDouble.empty(), reason);
    }

    public static YieldPoint missing(int maturityYears) {
        return missing(maturityYears, maturityYears + "-year", "");
    }

    public boolean isPresent() { return yieldPercent.isPresent(); }
}

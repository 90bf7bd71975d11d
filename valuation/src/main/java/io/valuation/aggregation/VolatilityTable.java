package io.valuation.aggregation;

import io.valuation.analytics.Frequency;
import io.valuation.analytics.VolatilityEstimate;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Per-ticker volatilities in input ticker order, successes and failures alike, plus their average.
 */
public record VolatilityTable(LocalDate periodStart,
                              LocalDate periodEnd,
                              Frequency frequency,
                              List<TickerVolatility> rows) {
    public VolatilityTable {
        rows = List.copyOf(rows);
    }

    public List<VolatilityEstimate> successes() {
        return rows.stream().filter(TickerVolatility::succeeded).map(r -> r.result().value()).toList();
    }

    public List<TickerVolatility> failures() {
        return rows.stream().filter(r -> !r.succeeded()).toList();
    }

    public List<String> failedTickers() {
        return failures().stream().map(TickerVolatility::ticker).toList();
    }

    /** Arithmetic mean of the successful percentages; empty when no ticker succeeded. */
    public OptionalDouble averagePercent() {
        return successes().stream().mapToDouble(VolatilityEstimate::annualizedVolatilityPercent).average();
    }

    /** {@link #averagePercent()} as a fraction, the form the pricer takes. */
    public OptionalDouble averageFraction() {
        OptionalDouble p = averagePercent();
        return p.isPresent() ? OptionalDouble.of(p.getAsDouble() / 100.0) : OptionalDouble.empty();
    }
}

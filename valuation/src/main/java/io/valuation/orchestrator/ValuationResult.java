package io.valuation.orchestrator;

import io.valuation.aggregation.VolatilityTable;
import io.valuation.analytics.YieldCurve;
import io.valuation.analytics.YieldPoint;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one valuation run produced: the headline figures, and the tables they were derived from
 * (per-ticker volatilities, the observed reference yields, the interpolated curve, the inputs).
 * Rates and volatility are fractions; the tables keep percentages.
 */
public record ValuationResult(OptionParameters inputs,
                              int yearsToMaturity,
                              LocalDate historyStart,
                              LocalDate historyEnd,
                              VolatilityTable volatilities,
                              List<YieldPoint> yieldPoints,
                              YieldCurve yieldCurve,
                              double riskFreeRate,
                              double averageVolatility,
                              double optionValue) {
    public ValuationResult {
        yieldPoints = List.copyOf(yieldPoints);
    }

    public List<YieldPoint> missingYields() {
        return yieldPoints.stream().filter(p -> !p.isPresent()).toList();
    }
}

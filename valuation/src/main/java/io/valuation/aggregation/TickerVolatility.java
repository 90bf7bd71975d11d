package io.valuation.aggregation;

import io.valuation.analytics.VolatilityEstimate;
import io.valuation.core.Result;

/** One row of the volatility table: a ticker and what became of it. */
public record TickerVolatility(String ticker, Result<VolatilityEstimate> result) {
    public boolean succeeded() { return result.isOk(); }
}

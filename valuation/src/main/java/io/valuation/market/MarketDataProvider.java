package io.valuation.market;

import io.valuation.analytics.PriceSeries;

import java.time.LocalDate;

/**
 * Where historical prices and reference yields come from. Implementations own their own timeout and
 * retry policy; callers treat each call as a single blocking request.
 */
public interface MarketDataProvider {
    /**
     * Adjusted daily closes for [start, end).
     *
     * @throws io.valuation.error.NoDataException when the range has no observations
     */
    PriceSeries fetchPriceSeries(String ticker, LocalDate start, LocalDate end) throws Exception;

    /**
     * Yield in percent quoted for the instrument on, or shortly before, the given date.
     *
     * @throws io.valuation.error.NoDataException when nothing was quoted around that date
     */
    double fetchYield(String symbol, LocalDate aroundDate) throws Exception;
}

package io.valuation.analytics;

import java.time.LocalDate;

/**
 * Annualized historical volatility of one ticker over [periodStart, periodEnd], in percent
 * (2 decimals). returnCount is the number of log returns the figure was computed from.
 */
public record VolatilityEstimate(String ticker,
                                 LocalDate periodStart,
                                 LocalDate periodEnd,
                                 Frequency frequency,
                                 double annualizedVolatilityPercent,
                                 int returnCount) {
}

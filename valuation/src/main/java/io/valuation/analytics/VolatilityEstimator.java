package io.valuation.analytics;

import io.valuation.error.DataException;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Historical volatility from adjusted closes.
 *
 * <ol>
 *   <li>resample to the requested cadence (last observation per period),</li>
 *   <li>r[t] = ln(P[t] / P[t-1]) over consecutive resampled periods; a return touching a period with
 *   no observation is dropped,</li>
 *   <li>sample standard deviation of r (n - 1 denominator),</li>
 *   <li>times sqrt(periods per year), as a percentage rounded to 2 decimals.</li>
 * </ol>
 *
 * Stateless; one instance may serve any number of threads.
 */
public class VolatilityEstimator {

    public double estimate(PriceSeries series, Frequency frequency) {
        return estimate(series, frequency, null, null).annualizedVolatilityPercent();
    }

    public double estimate(PriceSeries series, String frequency) {
        return estimate(series, Frequency.parse(frequency));
    }

    /**
     * Full estimate, stamped with the requested window. A null bound falls back to the series' own
     * first / last date.
     */
    public VolatilityEstimate estimate(PriceSeries series, Frequency frequency, LocalDate periodStart, LocalDate periodEnd) {
        if (frequency == null) throw new DataException("Invalid frequency: null. Use 'daily', 'weekly', or 'monthly'.");
        if (series == null || series.isEmpty()) {
            throw new DataException("No price data for " + (series == null ? "<null>" : series.ticker()));
        }
        List<PricePoint> prices = Resampler.resample(series.points(), frequency);
        double[] returns = logReturns(prices, series.ticker());
        if (returns.length < 2) {
            throw new DataException("Not enough " + frequency + " observations for " + series.ticker()
                    + " to compute volatility: " + returns.length + " usable returns after resampling");
        }
        double perPeriod = new StandardDeviation(true).evaluate(returns);
        double percent = Rounding.round(perPeriod * frequency.annualizationFactor() * 100.0, 2);
        LocalDate start = periodStart != null ? periodStart : series.points().get(0).date();
        LocalDate end = periodEnd != null ? periodEnd : series.points().get(series.size() - 1).date();
        return new VolatilityEstimate(series.ticker(), start, end, frequency, percent, returns.length);
    }

    static double[] logReturns(List<PricePoint> prices, String ticker) {
        for (PricePoint p : prices) {
            if (!Resampler.isMissing(p) && p.adjClose() <= 0) {
                throw new DataException("Non-positive price for " + ticker + " near " + p.date());
            }
        }
        if (prices.size() < 2) return new double[0];
        double[] out = new double[prices.size() - 1];
        int n = 0;
        for (int i = 1; i < prices.size(); i++) {
            PricePoint prev = prices.get(i - 1);
            PricePoint cur = prices.get(i);
            if (Resampler.isMissing(prev) || Resampler.isMissing(cur)) continue;
            out[n++] = Math.log(cur.adjClose() / prev.adjClose());
        }
        return Arrays.copyOf(out, n);
    }
}

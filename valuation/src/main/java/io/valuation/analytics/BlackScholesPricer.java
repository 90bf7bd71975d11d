package io.valuation.analytics;

import io.valuation.error.DomainException;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * European call under Black-Scholes, no dividends.
 *
 * <pre>
 * d1 = (ln(S/K) + (r + sigma^2 / 2) * T) / (sigma * sqrt(T))
 * d2 = d1 - sigma * sqrt(T)
 * C  = S * N(d1) - K * exp(-r * T) * N(d2)
 * </pre>
 *
 * Unrounded; rounding belongs to whoever reports the figure.
 */
public class BlackScholesPricer {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    public double price(double spot, double strike, double maturityYears, double riskFreeRate, double volatility) {
        if (!(maturityYears > 0)) throw new DomainException("maturity must be positive, was " + maturityYears);
        if (!(volatility > 0)) throw new DomainException("volatility must be positive, was " + volatility);
        if (!(spot > 0)) throw new DomainException("spot must be positive, was " + spot);
        if (!(strike > 0)) throw new DomainException("strike must be positive, was " + strike);

        double sqrtT = Math.sqrt(maturityYears);
        double d1 = (Math.log(spot / strike) + (riskFreeRate + 0.5 * volatility * volatility) * maturityYears) / (volatility * sqrtT);
        double d2 = d1 - volatility * sqrtT;
        return spot * cdf(d1) - strike * Math.exp(-riskFreeRate * maturityYears) * cdf(d2);
    }

    static double cdf(double x) {
        return STANDARD_NORMAL.cumulativeProbability(x);
    }
}

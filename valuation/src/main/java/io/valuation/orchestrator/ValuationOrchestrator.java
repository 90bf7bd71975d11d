package io.valuation.orchestrator;

import io.valuation.aggregation.VolatilityAggregator;
import io.valuation.aggregation.VolatilityTable;
import io.valuation.aggregation.YieldCurveBuilder;
import io.valuation.analytics.BlackScholesPricer;
import io.valuation.analytics.Frequency;
import io.valuation.analytics.MaturityCalculator;
import io.valuation.analytics.YieldCurve;
import io.valuation.analytics.YieldCurveInterpolator;
import io.valuation.analytics.YieldPoint;
import io.valuation.config.ValuationConfig;
import io.valuation.error.DomainException;
import io.valuation.error.InsufficientDataException;
import io.valuation.market.YieldInstrument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Runs one valuation: years to maturity, comparable volatility, risk-free rate, then Black-Scholes.
 *
 * Steps run once each, in that order. Per-ticker and per-instrument fetch failures are absorbed by the
 * aggregator and the curve builder and show up in the result; anything else propagates unchanged.
 */
public class ValuationOrchestrator {
    private static final Logger log = LogManager.getLogger(ValuationOrchestrator.class);

    private final MaturityCalculator maturityCalculator;
    private final VolatilityAggregator volatilityAggregator;
    private final YieldCurveBuilder yieldCurveBuilder;
    private final YieldCurveInterpolator interpolator;
    private final BlackScholesPricer pricer;
    private final List<YieldInstrument> instruments;

    public ValuationOrchestrator(MaturityCalculator maturityCalculator,
                                 VolatilityAggregator volatilityAggregator,
                                 YieldCurveBuilder yieldCurveBuilder,
                                 YieldCurveInterpolator interpolator,
                                 BlackScholesPricer pricer,
                                 List<YieldInstrument> instruments) {
        this.maturityCalculator = Objects.requireNonNull(maturityCalculator);
        this.volatilityAggregator = Objects.requireNonNull(volatilityAggregator);
        this.yieldCurveBuilder = Objects.requireNonNull(yieldCurveBuilder);
        this.interpolator = Objects.requireNonNull(interpolator);
        this.pricer = Objects.requireNonNull(pricer);
        this.instruments = List.copyOf(instruments);
    }

    public ValuationResult run(ValuationConfig config) throws InterruptedException {
        return run(config.optionParameters(), config.publicComps(), config.frequency());
    }

    public ValuationResult run(OptionParameters params, List<String> comparables, Frequency frequency)
            throws InterruptedException {
        int years = maturityCalculator.yearsToMaturity(params.valuationDate(), params.expirationDate(), params.vestingEndDate());
        log.info("Years to maturity: {}", years);
        if (years < 1) {
            // an empty history window and a zero-year rate; nothing downstream can price it
            throw new DomainException("Years to maturity rounds to " + years + "; at least 1 is needed to value the option");
        }

        LocalDate historyEnd = params.valuationDate();
        LocalDate historyStart = historyEnd.minusYears(years);
        log.info("Fetching historical data from {} to {}", historyStart, historyEnd);

        VolatilityTable volatilities = volatilityAggregator.aggregate(comparables, historyStart, historyEnd, frequency);
        if (volatilities.averageFraction().isEmpty()) {
            throw new InsufficientDataException("No volatility could be computed for any of " + comparables
                    + " from " + historyStart + " to " + historyEnd, volatilities.failedTickers());
        }
        double averageVolatility = volatilities.averageFraction().getAsDouble();
        log.info("Average volatility: {}", averageVolatility);

        List<YieldPoint> points = yieldCurveBuilder.collect(instruments, params.valuationDate());
        YieldCurve curve = yieldCurveBuilder.curve(points);
        double riskFreeRate = interpolator.lookup(curve, years) / 100.0;
        log.info("Risk-free rate for {}-year: {}", years, riskFreeRate);

        double value = pricer.price(params.spot(), params.strike(), years, riskFreeRate, averageVolatility);
        log.info("Option valuation: {}", value);

        return new ValuationResult(params, years, historyStart, historyEnd, volatilities, points, curve,
                riskFreeRate, averageVolatility, value);
    }
}

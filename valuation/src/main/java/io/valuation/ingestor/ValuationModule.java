package io.valuation.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.valuation.aggregation.VolatilityAggregator;
import io.valuation.aggregation.YieldCurveBuilder;
import io.valuation.analytics.BlackScholesPricer;
import io.valuation.analytics.MaturityCalculator;
import io.valuation.analytics.VolatilityEstimator;
import io.valuation.analytics.YieldCurveInterpolator;
import io.valuation.config.RuntimeSettings;
import io.valuation.market.MarketDataProvider;
import io.valuation.market.YieldInstrument;
import io.valuation.orchestrator.ValuationOrchestrator;

/**
 * Wires the valuation core. A {@link MarketDataProvider} binding has to come from another module.
 */
public class ValuationModule extends AbstractModule {
    private final RuntimeSettings settings;

    public ValuationModule(RuntimeSettings settings) { this.settings = settings; }

    @Override
    protected void configure() {
        bind(RuntimeSettings.class).toInstance(settings);
        bind(MaturityCalculator.class).in(Singleton.class);
        bind(VolatilityEstimator.class).in(Singleton.class);
        bind(YieldCurveInterpolator.class).in(Singleton.class);
        bind(BlackScholesPricer.class).in(Singleton.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton VolatilityAggregator volatilityAggregator(MarketDataProvider provider, VolatilityEstimator estimator, MetricRegistry registry) {
        return new VolatilityAggregator(provider, estimator, registry, settings.workers(), settings.queueCapacity());
    }

    @Provides @Singleton YieldCurveBuilder yieldCurveBuilder(MarketDataProvider provider, YieldCurveInterpolator interpolator, MetricRegistry registry) {
        return new YieldCurveBuilder(provider, interpolator, registry);
    }

    @Provides @Singleton ValuationOrchestrator orchestrator(MaturityCalculator maturity, VolatilityAggregator aggregator,
                                                            YieldCurveBuilder curveBuilder, YieldCurveInterpolator interpolator,
                                                            BlackScholesPricer pricer) {
        return new ValuationOrchestrator(maturity, aggregator, curveBuilder, interpolator, pricer, YieldInstrument.US_TREASURIES);
    }
}

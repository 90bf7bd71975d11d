package io.valuation.aggregation;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.valuation.analytics.Frequency;
import io.valuation.analytics.PriceSeries;
import io.valuation.analytics.VolatilityEstimate;
import io.valuation.analytics.VolatilityEstimator;
import io.valuation.core.Record;
import io.valuation.core.Result;
import io.valuation.market.MarketDataProvider;
import io.valuation.runtime.Pipeline;
import io.valuation.runtime.PipelineBuilder;
import io.valuation.source.TickerListSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Estimates the volatility of each comparable ticker and collects them into one table.
 *
 * Tickers are fetched and estimated in parallel on a {@link Pipeline}; the table always comes back in
 * the order the tickers were given. A ticker whose fetch or estimate fails is kept as a failed row
 * and left out of the average; it never aborts the others.
 */
public class VolatilityAggregator {
    private static final Logger log = LogManager.getLogger(VolatilityAggregator.class);

    private final MarketDataProvider provider;
    private final VolatilityEstimator estimator;
    private final MetricRegistry registry;
    private final int workers;
    private final int queueCapacity;
    private final Counter succeeded;
    private final Counter failed;

    public VolatilityAggregator(MarketDataProvider provider, VolatilityEstimator estimator, MetricRegistry registry,
                                int workers, int queueCapacity) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workers = Math.max(1, workers);
        this.queueCapacity = Math.max(1, queueCapacity);
        this.succeeded = registry.counter("volatility.tickers.succeeded");
        this.failed = registry.counter("volatility.tickers.failed");
    }

    /**
     * @throws InterruptedException if interrupted while tickers are in flight; work still running is
     *                              abandoned and nothing partial is returned
     */
    public VolatilityTable aggregate(List<String> tickers, LocalDate periodStart, LocalDate periodEnd, Frequency frequency)
            throws InterruptedException {
        Objects.requireNonNull(frequency, "frequency");
        List<String> ordered = List.copyOf(tickers);
        TreeMap<Long, TickerVolatility> rows = new TreeMap<>();

        Pipeline<String, TickerVolatility> pipeline = new PipelineBuilder<String, TickerVolatility>()
                .source(new TickerListSource(ordered))
                .transform(in -> estimateOne(in.payload(), periodStart, periodEnd, frequency))
                .sink((Record<TickerVolatility> r) -> rows.put(r.seq(), r.payload()))
                .workers(Math.min(workers, Math.max(1, ordered.size())))
                .queueCapacity(queueCapacity)
                .metrics(registry)
                .name("volatility")
                .build();

        pipeline.start();
        try {
            pipeline.awaitCompletion();
        } catch (InterruptedException ie) {
            pipeline.close();
            throw ie;
        }

        // rows is only written by the sink thread, which has terminated
        for (Pipeline.Failure f : pipeline.failures()) {
            int i = (int) f.seq();
            if (!rows.containsKey(f.seq()) && i < ordered.size()) {
                failed.inc();
                rows.put(f.seq(), new TickerVolatility(ordered.get(i), Result.failed(f.error())));
            }
        }
        List<TickerVolatility> out = new ArrayList<>(rows.values());
        VolatilityTable table = new VolatilityTable(periodStart, periodEnd, frequency, out);
        log.info("Volatility for {} of {} tickers from {} to {} ({})", table.successes().size(), ordered.size(),
                periodStart, periodEnd, frequency);
        return table;
    }

    TickerVolatility estimateOne(String ticker, LocalDate periodStart, LocalDate periodEnd, Frequency frequency)
            throws InterruptedException {
        try {
            PriceSeries series = provider.fetchPriceSeries(ticker, periodStart, periodEnd);
            VolatilityEstimate estimate = estimator.estimate(series, frequency, periodStart, periodEnd);
            succeeded.inc();
            log.info("Volatility for {}: {}", ticker, estimate.annualizedVolatilityPercent());
            return new TickerVolatility(ticker, Result.ok(estimate));
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            failed.inc();
            log.warn("Error for {} from {} to {}: {}", ticker, periodStart, periodEnd, e.getMessage());
            return new TickerVolatility(ticker, Result.failed(e));
        }
    }
}

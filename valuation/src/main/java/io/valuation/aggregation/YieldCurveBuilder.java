package io.valuation.aggregation;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.valuation.analytics.YieldCurve;
import io.valuation.analytics.YieldCurveInterpolator;
import io.valuation.analytics.YieldPoint;
import io.valuation.market.MarketDataProvider;
import io.valuation.market.YieldInstrument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Fetches the reference yields for a date, one instrument at a time in maturity order. An instrument
 * that cannot be fetched becomes a missing point carrying the failure.
 */
public class YieldCurveBuilder {
    private static final Logger log = LogManager.getLogger(YieldCurveBuilder.class);

    private final MarketDataProvider provider;
    private final YieldCurveInterpolator interpolator;
    private final Counter fetched;
    private final Counter missing;

    public YieldCurveBuilder(MarketDataProvider provider, YieldCurveInterpolator interpolator, MetricRegistry registry) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
        this.fetched = registry.counter("yield.instruments.fetched");
        this.missing = registry.counter("yield.instruments.missing");
    }

    public List<YieldPoint> collect(List<YieldInstrument> instruments, LocalDate date) throws InterruptedException {
        List<YieldInstrument> ordered = new ArrayList<>(instruments);
        ordered.sort(Comparator.comparingInt(YieldInstrument::maturityYears));
        List<YieldPoint> points = new ArrayList<>(ordered.size());
        for (YieldInstrument instrument : ordered) {
            log.info("Fetching treasury yield for {} ({})", instrument.label(), instrument.symbol());
            try {
                double y = provider.fetchYield(instrument.symbol(), date);
                fetched.inc();
                log.info("Yield for {}: {}", instrument.label(), y);
                points.add(YieldPoint.present(instrument.maturityYears(), instrument.label(), y));
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                missing.inc();
                log.warn("Error fetching data for {} on {}: {}", instrument.label(), date, e.getMessage());
                points.add(YieldPoint.missing(instrument.maturityYears(), instrument.label(), describe(e)));
            }
        }
        return points;
    }

    /** Collected points interpolated onto a whole-year curve. */
    public YieldCurve curve(List<YieldPoint> points) {
        YieldCurve curve = interpolator.buildCurve(points);
        log.debug("Interpolated curve: {}", curve);
        return curve;
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}

package io.valuation.marketdata;

import com.codahale.metrics.MetricRegistry;
import io.valuation.analytics.PricePoint;
import io.valuation.analytics.PriceSeries;
import io.valuation.analytics.Rounding;
import io.valuation.error.NoDataException;
import io.valuation.market.MarketDataProvider;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link MarketDataProvider} over Yahoo Finance daily charts.
 *
 * Price series use the adjusted close, falling back to the close when Yahoo sends no adjusted series.
 * Yields are the close of a yield index (already in percent) on the requested date, or the last close of
 * the preceding week when that date has none.
 */
public class YahooMarketDataProvider implements MarketDataProvider {
    private static final String DAILY = "1d";
    private static final int YIELD_LOOKBACK_DAYS = 7;

    private final YahooClient client;
    private final MetricRegistry registry;

    public YahooMarketDataProvider(YahooClient client, MetricRegistry registry) {
        this.client = client;
        this.registry = registry;
    }

    @Override
    public PriceSeries fetchPriceSeries(String ticker, LocalDate start, LocalDate end) throws Exception {
        List<YahooChart.Bar> bars = fetchBars(ticker, start, end);
        List<PricePoint> points = new ArrayList<>(bars.size());
        LocalDate last = null;
        for (YahooChart.Bar b : bars) {
            double px = Double.isNaN(b.adjClose()) ? b.close() : b.adjClose();
            if (!(px > 0)) continue;
            // Yahoo occasionally repeats the live bar; keep the first of a date
            if (last != null && !b.date().isAfter(last)) continue;
            points.add(new PricePoint(b.date(), px));
            last = b.date();
        }
        if (points.isEmpty()) {
            throw new NoDataException("No data found for " + ticker + " from " + start + " to " + end);
        }
        return new PriceSeries(ticker, points);
    }

    @Override
    public double fetchYield(String symbol, LocalDate aroundDate) throws Exception {
        LocalDate from = aroundDate.minusDays(YIELD_LOOKBACK_DAYS);
        List<YahooChart.Bar> bars = fetchBars(symbol, from, aroundDate.plusDays(1));
        if (bars.isEmpty()) {
            throw new NoDataException("No data found for " + symbol + " around " + aroundDate);
        }
        YahooChart.Bar pick = bars.get(bars.size() - 1);
        for (YahooChart.Bar b : bars) {
            if (b.date().equals(aroundDate)) { pick = b; break; }
        }
        return Rounding.round(pick.close(), 2);
    }

    /** Bars dated within [start, end). */
    private List<YahooChart.Bar> fetchBars(String symbol, LocalDate start, LocalDate end) throws Exception {
        long p1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = end.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        if (registry != null) registry.counter("yahoo.fetch.requests").inc();
        String body;
        try {
            body = client.fetch(symbol, p1, p2, DAILY);
        } catch (Exception e) {
            if (registry != null) registry.counter("yahoo.fetch.failures").inc();
            throw e;
        }
        List<YahooChart.Bar> out = new ArrayList<>();
        for (YahooChart.Bar b : YahooChart.parse(symbol, body).bars()) {
            if (b.date().isBefore(start) || !b.date().isBefore(end)) continue;
            out.add(b);
        }
        if (out.isEmpty() && registry != null) registry.counter("yahoo.fetch.zeroRows").inc();
        return out;
    }
}

package io.valuation.analytics;

import io.valuation.error.DataException;

import java.util.List;
import java.util.Objects;

/**
 * Adjusted closes for one ticker, dates strictly increasing. May be empty; consumers decide
 * whether that is an error.
 */
public record PriceSeries(String ticker, List<PricePoint> points) {
    public PriceSeries {
        Objects.requireNonNull(ticker, "ticker");
        points = List.copyOf(Objects.requireNonNull(points, "points"));
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).date().isAfter(points.get(i - 1).date())) {
                throw new DataException("Price series for " + ticker + " is not strictly increasing at "
                        + points.get(i).date());
            }
        }
    }

    public int size() { return points.size(); }
    public boolean isEmpty() { return points.isEmpty(); }
}

package io.valuation.analytics;

import java.time.LocalDate;
import java.util.Objects;

/** One adjusted close. */
public record PricePoint(LocalDate date, double adjClose) {
    public PricePoint {
        Objects.requireNonNull(date, "date");
    }
}

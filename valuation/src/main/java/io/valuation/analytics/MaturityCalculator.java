package io.valuation.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Years to maturity of a grant: the average of (valuation -> expiration) and (valuation -> vesting end),
 * each measured as days / 365, rounded to the nearest whole year with halves rounding up.
 *
 * The average is formed as (daysToExpiration + daysToVestingEnd) / 730 in exact decimal arithmetic so a
 * true half is never nudged either way by binary floating point.
 */
public class MaturityCalculator {
    private static final BigDecimal DAYS_IN_TWO_YEARS = BigDecimal.valueOf(730);

    public int yearsToMaturity(LocalDate valuationDate, LocalDate expirationDate, LocalDate vestingEndDate) {
        Objects.requireNonNull(valuationDate, "valuationDate");
        Objects.requireNonNull(expirationDate, "expirationDate");
        Objects.requireNonNull(vestingEndDate, "vestingEndDate");
        if (expirationDate.isBefore(valuationDate)) {
            throw new IllegalArgumentException("expiration date " + expirationDate + " is before valuation date " + valuationDate);
        }
        if (vestingEndDate.isBefore(valuationDate)) {
            throw new IllegalArgumentException("vesting end date " + vestingEndDate + " is before valuation date " + valuationDate);
        }
        long toExpiration = ChronoUnit.DAYS.between(valuationDate, expirationDate);
        long toVestingEnd = ChronoUnit.DAYS.between(valuationDate, vestingEndDate);
        return BigDecimal.valueOf(toExpiration + toVestingEnd)
                .divide(DAYS_IN_TWO_YEARS, 0, RoundingMode.HALF_UP)
                .intValueExact();
    }

    /** Unrounded average, for reporting. */
    public double fractionalYears(LocalDate valuationDate, LocalDate expirationDate, LocalDate vestingEndDate) {
        double a = ChronoUnit.DAYS.between(valuationDate, expirationDate) / 365.0;
        double b = ChronoUnit.DAYS.between(valuationDate, vestingEndDate) / 365.0;
        return (a + b) / 2.0;
    }
}

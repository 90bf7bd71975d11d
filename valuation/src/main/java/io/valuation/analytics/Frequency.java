package io.valuation.analytics;

import io.valuation.error.DataException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Sampling cadence for volatility estimation, with its annualization basis.
 */
public enum Frequency {
    DAILY("daily", 252),
    WEEKLY("weekly", 52),
    MONTHLY("monthly", 12);

    private final String label;
    private final int periodsPerYear;

    Frequency(String label, int periodsPerYear) {
        this.label = label;
        this.periodsPerYear = periodsPerYear;
    }

    public String label() { return label; }
    public int periodsPerYear() { return periodsPerYear; }

    /** sqrt(periods per year) */
    public double annualizationFactor() { return Math.sqrt(periodsPerYear); }

    /**
     * Date of the bucket an observation falls in: itself for daily, the week's Friday for weekly,
     * the last day of the month for monthly.
     */
    public LocalDate bucket(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
            case MONTHLY -> date.with(TemporalAdjusters.lastDayOfMonth());
        };
    }

    /** Bucket following the given one, which must itself be a bucket date. */
    public LocalDate nextBucket(LocalDate bucket) {
        return switch (this) {
            case DAILY -> bucket.plusDays(1);
            case WEEKLY -> bucket.plusWeeks(1);
            case MONTHLY -> bucket.plusDays(1).with(TemporalAdjusters.lastDayOfMonth());
        };
    }

    /** Exact, lower-case label only. */
    public static Frequency parse(String value) {
        if (value == null) throw new DataException("Invalid frequency: null. Use 'daily', 'weekly', or 'monthly'.");
        for (Frequency f : values()) {
            if (f.label.equals(value)) return f;
        }
        throw new DataException("Invalid frequency: '" + value + "'. Use 'daily', 'weekly', or 'monthly'.");
    }

    @Override
    public String toString() { return label; }
}

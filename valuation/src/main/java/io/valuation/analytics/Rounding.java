package io.valuation.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Decimal rounding used wherever a figure is published; half-up everywhere. */
public final class Rounding {
    private Rounding() {}

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}

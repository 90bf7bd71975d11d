package io.valuation.market;

import java.util.List;
import java.util.Objects;

/**
 * A reference instrument on the risk-free curve: its maturity in whole years and the symbol it is
 * quoted under.
 */
public record YieldInstrument(int maturityYears, String symbol) {
    /** US Treasury yield indices as quoted by Yahoo Finance. */
    public static final List<YieldInstrument> US_TREASURIES = List.of(
            new YieldInstrument(1, "^IRX"),
            new YieldInstrument(5, "^FVX"),
            new YieldInstrument(10, "^TNX"),
            new YieldInstrument(30, "^TYX"));

    public YieldInstrument {
        if (maturityYears < 1) throw new IllegalArgumentException("maturity must be >= 1 year, was " + maturityYears);
        Objects.requireNonNull(symbol, "symbol");
    }

    public String label() { return maturityYears + "-year"; }
}

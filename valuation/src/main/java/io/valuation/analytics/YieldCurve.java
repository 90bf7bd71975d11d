package io.valuation.analytics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Yield (percent) for every whole maturity 1..maxMaturity, slot i holding maturity i + 1.
 * Either every slot holds a value or, when no reference yield was observed, none does.
 */
public final class YieldCurve {
    private final OptionalDouble[] yields;
    private final boolean[] observed;

    YieldCurve(OptionalDouble[] yields, boolean[] observed) {
        if (yields.length != observed.length) throw new IllegalArgumentException("length mismatch");
        this.yields = yields.clone();
        this.observed = observed.clone();
    }

    public static YieldCurve empty() {
        return new YieldCurve(new OptionalDouble[0], new boolean[0]);
    }

    public int maxMaturity() { return yields.length; }

    public OptionalDouble yieldAt(int maturityYears) {
        if (maturityYears < 1 || maturityYears > yields.length) return OptionalDouble.empty();
        return yields[maturityYears - 1];
    }

    /** True when the value at this maturity was observed rather than interpolated. */
    public boolean isObserved(int maturityYears) {
        return maturityYears >= 1 && maturityYears <= observed.length && observed[maturityYears - 1];
    }

    public boolean hasValues() {
        for (OptionalDouble y : yields) {
            if (y.isPresent()) return true;
        }
        return false;
    }

    /** 1..maxMaturity, whether or not each has a value. */
    public List<Integer> maturities() {
        List<Integer> out = new ArrayList<>(yields.length);
        for (int m = 1; m <= yields.length; m++) out.add(m);
        return Collections.unmodifiableList(out);
    }

    /** Maturities that carry a value. */
    public List<Integer> availableMaturities() {
        List<Integer> out = new ArrayList<>();
        for (int m = 1; m <= yields.length; m++) {
            if (yields[m - 1].isPresent()) out.add(m);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("YieldCurve{");
        for (int m = 1; m <= yields.length; m++) {
            if (m > 1) sb.append(", ");
            sb.append(m).append("y=");
            OptionalDouble y = yields[m - 1];
            sb.append(y.isPresent() ? Double.toString(y.getAsDouble()) : "n/a");
        }
        return sb.append('}').toString();
    }
}

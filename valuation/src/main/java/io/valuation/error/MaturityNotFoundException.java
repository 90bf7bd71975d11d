package io.valuation.error;

import java.util.List;

/**
 * Requested maturity has no value on the yield curve. Carries the maturities that do,
 * so the message alone is enough to see what the curve covered.
 */
public class MaturityNotFoundException extends ValuationException {
    private final int requestedMaturity;
    private final List<Integer> availableMaturities;

    public MaturityNotFoundException(int requestedMaturity, List<Integer> availableMaturities) {
        super("Maturity " + requestedMaturity + "-year not found on the yield curve. Available maturities: "
                + describe(availableMaturities));
        this.requestedMaturity = requestedMaturity;
        this.availableMaturities = List.copyOf(availableMaturities);
    }

    public int requestedMaturity() { return requestedMaturity; }
    public List<Integer> availableMaturities() { return availableMaturities; }

    private static String describe(List<Integer> maturities) {
        if (maturities.isEmpty()) return "none";
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < maturities.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(maturities.get(i)).append("-year");
        }
        return sb.append(']').toString();
    }
}

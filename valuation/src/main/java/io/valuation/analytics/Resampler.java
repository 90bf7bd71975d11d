package io.valuation.analytics;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the last observation of each period. Output is dated by period end (Friday / month end),
 * not by the date of the observation kept.
 *
 * Every period between the first and the last observed one is present in the output; a period with no
 * observation carries {@link Double#NaN} so that no return is ever taken across it.
 */
public final class Resampler {
    private Resampler() {
    }

    public static List<PricePoint> resample(List<PricePoint> in, Frequency to) {
        if (to == Frequency.DAILY || in.isEmpty()) return in;
        Map<LocalDate, Double> buckets = new LinkedHashMap<>();
        for (PricePoint p : in) {
            buckets.put(to.bucket(p.date()), p.adjClose());
        }
        LocalDate last = to.bucket(in.get(in.size() - 1).date());
        List<PricePoint> out = new ArrayList<>(buckets.size());
        for (LocalDate b = to.bucket(in.get(0).date()); !b.isAfter(last); b = to.nextBucket(b)) {
            out.add(new PricePoint(b, buckets.getOrDefault(b, Double.NaN)));
        }
        return out;
    }

    /** True for the placeholder of a period without observations. */
    public static boolean isMissing(PricePoint p) {
        return Double.isNaN(p.adjClose());
    }
}

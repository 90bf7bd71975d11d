package io.valuation.analytics;

import io.valuation.error.DataException;
import io.valuation.error.MaturityNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Builds a whole-year yield curve from sparse reference yields by piecewise-linear interpolation.
 *
 * The curve spans 1 up to the longest reference maturity, observed or not. Observed yields are kept
 * exactly as given; interpolated ones are rounded to 2 decimals. Outside the observed range the nearest
 * observed yield is carried flat.
 */
public class YieldCurveInterpolator {

    public YieldCurve buildCurve(List<YieldPoint> points) {
        if (points == null || points.isEmpty()) return YieldCurve.empty();

        int maxMaturity = 0;
        List<YieldPoint> observed = new ArrayList<>();
        for (YieldPoint p : points) {
            maxMaturity = Math.max(maxMaturity, p.maturityYears());
            if (p.isPresent()) observed.add(p);
        }
        observed.sort(Comparator.comparingInt(YieldPoint::maturityYears));

        double[] xs = new double[observed.size()];
        double[] ys = new double[observed.size()];
        for (int i = 0; i < observed.size(); i++) {
            if (i > 0 && observed.get(i).maturityYears() == observed.get(i - 1).maturityYears()) {
                throw new DataException("Duplicate yield for maturity " + observed.get(i).maturityYears() + "-year");
            }
            xs[i] = observed.get(i).maturityYears();
            ys[i] = observed.get(i).yieldPercent().getAsDouble();
        }

        OptionalDouble[] yields = new OptionalDouble[maxMaturity];
        boolean[] isObserved = new boolean[maxMaturity];
        int next = 0;
        for (int m = 1; m <= maxMaturity; m++) {
            if (observed.isEmpty()) {
                yields[m - 1] = OptionalDouble.empty();
            } else if (next < xs.length && xs[next] == m) {
                yields[m - 1] = OptionalDouble.of(ys[next]);
                isObserved[m - 1] = true;
                next++;
            } else {
                yields[m - 1] = OptionalDouble.of(Rounding.round(interpolate(m, xs, ys), 2));
            }
        }
        return new YieldCurve(yields, isObserved);
    }

    /**
     * Yield in percent at the given maturity.
     *
     * @throws MaturityNotFoundException when the maturity is outside the curve or the curve is empty
     */
    public double lookup(YieldCurve curve, int maturityYears) {
        OptionalDouble y = curve.yieldAt(maturityYears);
        if (y.isEmpty()) {
            throw new MaturityNotFoundException(maturityYears, curve.availableMaturities());
        }
        return y.getAsDouble();
    }

    /**
     * Piecewise-linear interpolation over ascending xs, flat beyond either end.
     */
    public static double interpolate(double x, double[] xs, double[] ys) {
        if (xs.length == 0) throw new IllegalArgumentException("no points to interpolate from");
        int last = xs.length - 1;
        if (x <= xs[0]) return ys[0];
        if (x >= xs[last]) return ys[last];
        int i = 0;
        while (xs[i + 1] < x) i++;
        double w = (x - xs[i]) / (xs[i + 1] - xs[i]);
        return ys[i] + (ys[i + 1] - ys[i]) * w;
    }
}

package io.valuation.marketdata;

import io.valuation.aggregation.TickerVolatility;
import io.valuation.aggregation.VolatilityTable;
import io.valuation.analytics.Rounding;
import io.valuation.analytics.YieldCurve;
import io.valuation.orchestrator.OptionParameters;
import io.valuation.orchestrator.ValuationResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * The three report tables for a valuation: the summary ("Black Scholes"), the per-ticker volatilities
 * with their average, and the interpolated risk-free curve.
 */
public record ValuationReport(ReportTable summary, ReportTable volatility, ReportTable riskFreeRate) {
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    public static ValuationReport from(ValuationResult result) {
        return new ValuationReport(summary(result), volatility(result.volatilities()),
                riskFreeRate(result.yieldCurve(), result.inputs().valuationDate()));
    }

    public List<ReportTable> tables() { return List.of(summary, volatility, riskFreeRate); }

    static ReportTable summary(ValuationResult result) {
        OptionParameters in = result.inputs();
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Grant date", US_DATE.format(in.grantDate())));
        rows.add(List.of("Valuation date", US_DATE.format(in.valuationDate())));
        rows.add(List.of("Expiration date", US_DATE.format(in.expirationDate())));
        rows.add(List.of("Vesting end date", US_DATE.format(in.vestingEndDate())));
        rows.add(List.of("Stock price", number(in.spot())));
        rows.add(List.of("Strike/Exercise price", number(in.strike())));
        rows.add(List.of("Years to maturity (YTM)", Integer.toString(result.yearsToMaturity())));
        rows.add(List.of("Risk free rate", number(Rounding.round(result.riskFreeRate(), 4))));
        rows.add(List.of("Volatility", number(Rounding.round(result.averageVolatility(), 4))));
        rows.add(List.of("Option Valuation", number(Rounding.round(result.optionValue(), 2))));
        return new ReportTable("Black Scholes", "black_scholes.csv", List.of("", "Value"), rows);
    }

    static ReportTable volatility(VolatilityTable table) {
        String period = table.periodStart() + " to " + table.periodEnd();
        List<List<String>> rows = new ArrayList<>();
        for (TickerVolatility row : table.rows()) {
            if (row.succeeded()) {
                rows.add(List.of(row.ticker(), number(row.result().value().annualizedVolatilityPercent()), ""));
            } else {
                rows.add(List.of(row.ticker(), "", row.result().errorMessage()));
            }
        }
        OptionalDouble avg = table.averagePercent();
        rows.add(List.of("Average", avg.isPresent() ? number(Rounding.round(avg.getAsDouble(), 2)) : "", ""));
        return new ReportTable("Volatility", "volatility.csv", List.of("Ticker", period, "Error"), rows);
    }

    static ReportTable riskFreeRate(YieldCurve curve, LocalDate valuationDate) {
        List<List<String>> rows = new ArrayList<>();
        for (int m : curve.maturities()) {
            OptionalDouble y = curve.yieldAt(m);
            rows.add(List.of(m + "-year", y.isPresent() ? number(y.getAsDouble()) : ""));
        }
        return new ReportTable("Risk Free Rate", "risk_free_rate.csv", List.of("Maturity", valuationDate.toString()), rows);
    }

    static String number(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return "";
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}

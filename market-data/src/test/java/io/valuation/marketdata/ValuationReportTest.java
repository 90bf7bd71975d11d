package io.valuation.marketdata;

import io.valuation.aggregation.TickerVolatility;
import io.valuation.aggregation.VolatilityTable;
import io.valuation.analytics.Frequency;
import io.valuation.analytics.VolatilityEstimate;
import io.valuation.analytics.YieldCurve;
import io.valuation.analytics.YieldCurveInterpolator;
import io.valuation.analytics.YieldPoint;
import io.valuation.core.Result;
import io.valuation.error.NoDataException;
import io.valuation.orchestrator.OptionParameters;
import io.valuation.orchestrator.ValuationResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValuationReportTest {
    static final LocalDate START = LocalDate.of(2016, 1, 1);
    static final LocalDate END = LocalDate.of(2020, 1, 1);

    static ValuationResult sampleResult() {
        OptionParameters grant = new OptionParameters(50.0, 45.0, LocalDate.of(2019, 6, 1),
                END, LocalDate.of(2025, 1, 1), LocalDate.of(2023, 1, 1));
        VolatilityTable vols = new VolatilityTable(START, END, Frequency.DAILY, List.of(
                new TickerVolatility("AAA", Result.ok(new VolatilityEstimate("AAA", START, END, Frequency.DAILY, 31.87, 4))),
                new TickerVolatility("BBB", Result.failed(new NoDataException("No data found, symbol may be delisted"))),
                new TickerVolatility("CCC", Result.ok(new VolatilityEstimate("CCC", START, END, Frequency.DAILY, 64.68, 5)))));
        List<YieldPoint> points = List.of(
                YieldPoint.present(1, "1-year", 1.56),
                YieldPoint.present(5, "5-year", 1.69),
                YieldPoint.present(10, "10-year", 1.88),
                YieldPoint.present(30, "30-year", 2.33));
        YieldCurve curve = new YieldCurveInterpolator().buildCurve(points);
        return new ValuationResult(grant, 4, START, END, vols, points, curve, 0.0166, 0.48275, 21.26752962092347);
    }

    @Test
    void summaryListsInputsAndHeadlineFigures() {
        ReportTable t = ValuationReport.from(sampleResult()).summary();

        assertEquals("black_scholes.csv", t.fileName());
        assertEquals(List.of("", "Value"), t.header());
        assertEquals(List.of(
                List.of("Grant date", "6/1/2019"),
                List.of("Valuation date", "1/1/2020"),
                List.of("Expiration date", "1/1/2025"),
                List.of("Vesting end date", "1/1/2023"),
                List.of("Stock price", "50"),
                List.of("Strike/Exercise price", "45"),
                List.of("Years to maturity (YTM)", "4"),
                List.of("Risk free rate", "0.0166"),
                List.of("Volatility", "0.4828"),
                List.of("Option Valuation", "21.27")), t.rows());
    }

    @Test
    void volatilityTableKeepsFailedTickersAndAverages() {
        ReportTable t = ValuationReport.from(sampleResult()).volatility();

        assertEquals(List.of("Ticker", "2016-01-01 to 2020-01-01", "Error"), t.header());
        assertEquals(List.of("AAA", "31.87", ""), t.rows().get(0));
        assertEquals(List.of("BBB", "", "No data found, symbol may be delisted"), t.rows().get(1));
        assertEquals(List.of("CCC", "64.68", ""), t.rows().get(2));
        assertEquals(List.of("Average", "48.28", ""), t.rows().get(3));
    }

    @Test
    void riskFreeTableHasEveryWholeMaturity() {
        ReportTable t = ValuationReport.from(sampleResult()).riskFreeRate();

        assertEquals(List.of("Maturity", "2020-01-01"), t.header());
        assertEquals(30, t.rows().size());
        assertEquals(List.of("1-year", "1.56"), t.rows().get(0));
        assertEquals(List.of("4-year", "1.66"), t.rows().get(3));
        assertEquals(List.of("30-year", "2.33"), t.rows().get(29));
    }

    @Test
    void csvQuotesCellsThatNeedIt() {
        String csv = ValuationReport.from(sampleResult()).volatility().toCsv();

        assertTrue(csv.startsWith("Ticker,2016-01-01 to 2020-01-01,Error\n"));
        assertTrue(csv.contains("BBB,,\"No data found, symbol may be delisted\"\n"));
        assertTrue(csv.endsWith("Average,48.28,\n"));
    }

    @Test
    void numbersArePlain() {
        assertEquals("2", ValuationReport.number(2.0));
        assertEquals("0.0001", ValuationReport.number(0.0001));
        assertEquals("", ValuationReport.number(Double.NaN));
    }
}

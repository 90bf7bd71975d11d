package io.valuation.analytics;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class MaturityCalculatorTest {
    private final MaturityCalculator calc = new MaturityCalculator();

    @Test
    void averagesExpirationAndVestingHorizons() {
        // (5 + 3) / 2 = 4
        int years = calc.yearsToMaturity(LocalDate.of(2020, 1, 1), LocalDate.of(2025, 1, 1), LocalDate.of(2023, 1, 1));
        assertEquals(4, years);
    }

    @Test
    void exactHalfRoundsUp() {
        LocalDate valuation = LocalDate.of(2021, 3, 15);
        // 1095 + 730 days = 2.5 years on average
        int years = calc.yearsToMaturity(valuation, valuation.plusDays(1095), valuation.plusDays(730));
        assertEquals(3, years);
    }

    @Test
    void justBelowHalfRoundsDown() {
        LocalDate valuation = LocalDate.of(2021, 3, 15);
        int years = calc.yearsToMaturity(valuation, valuation.plusDays(1094), valuation.plusDays(730));
        assertEquals(2, years);
    }

    @Test
    void shiftingAllDatesTogetherDoesNotChangeResult() {
        LocalDate v = LocalDate.of(2018, 7, 9);
        LocalDate e = LocalDate.of(2027, 2, 28);
        LocalDate s = LocalDate.of(2021, 11, 30);
        int base = calc.yearsToMaturity(v, e, s);
        for (int shift : new int[]{1, 17, 365, 1000, -400}) {
            assertEquals(base, calc.yearsToMaturity(v.plusDays(shift), e.plusDays(shift), s.plusDays(shift)), "shift " + shift);
        }
    }

    @Test
    void sameDayGivesZero() {
        LocalDate d = LocalDate.of(2022, 1, 1);
        assertEquals(0, calc.yearsToMaturity(d, d, d));
    }

    @Test
    void datesBeforeValuationAreRejected() {
        LocalDate v = LocalDate.of(2020, 1, 1);
        assertThrows(IllegalArgumentException.class, () -> calc.yearsToMaturity(v, v.minusDays(1), v.plusYears(1)));
        assertThrows(IllegalArgumentException.class, () -> calc.yearsToMaturity(v, v.plusYears(1), v.minusDays(1)));
        assertThrows(NullPointerException.class, () -> calc.yearsToMaturity(null, v, v));
    }

    @Test
    void fractionalYearsIsTheUnroundedAverage() {
        double f = calc.fractionalYears(LocalDate.of(2020, 1, 1), LocalDate.of(2025, 1, 1), LocalDate.of(2023, 1, 1));
        assertEquals((1827 / 365.0 + 1096 / 365.0) / 2.0, f, 1e-12);
    }
}

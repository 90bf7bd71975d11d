package io.valuation.analytics;

import io.valuation.error.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlackScholesPricerTest {
    private final BlackScholesPricer pricer = new BlackScholesPricer();

    @Test
    void atTheMoneyReferenceValue() {
        assertEquals(10.45, pricer.price(100, 100, 1, 0.05, 0.2), 0.01);
        assertEquals(10.450583572185565, pricer.price(100, 100, 1, 0.05, 0.2), 1e-6);
    }

    @Test
    void grantRegressionValue() {
        // spot 50, strike 45, 4 years, 4-year treasury 1.66%, 30% volatility
        assertEquals(15.233770934329016, pricer.price(50, 45, 4, 0.0166, 0.30), 1e-6);
    }

    @Test
    void valueIsBoundedByIntrinsicAndSpot() {
        double v = pricer.price(50, 45, 4, 0.0166, 0.30);
        assertTrue(v > 50 - 45 * Math.exp(-0.0166 * 4));
        assertTrue(v < 50);
    }

    @Test
    void cdfIsTheStandardNormal() {
        assertEquals(0.5, BlackScholesPricer.cdf(0.0), 1e-12);
        assertEquals(0.975, BlackScholesPricer.cdf(1.959963984540054), 1e-9);
    }

    @Test
    void nonPositiveMaturityOrVolatilityIsOutsideTheModel() {
        assertThrows(DomainException.class, () -> pricer.price(100, 100, 0, 0.05, 0.2));
        assertThrows(DomainException.class, () -> pricer.price(100, 100, -1, 0.05, 0.2));
        assertThrows(DomainException.class, () -> pricer.price(100, 100, 1, 0.05, 0));
        assertThrows(DomainException.class, () -> pricer.price(100, 100, 1, 0.05, Double.NaN));
        assertThrows(DomainException.class, () -> pricer.price(0, 100, 1, 0.05, 0.2));
    }
}

package io.valuation.core;

import io.valuation.error.NoDataException;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {
    @Test
    void okCarriesValue() {
        Result<Double> r = Result.ok(31.87);
        assertTrue(r.isOk());
        assertEquals(31.87, r.value());
        assertTrue(r.error().isEmpty());
        assertEquals("", r.errorMessage());
        assertEquals(Result.ok(31.87), r);
    }

    @Test
    void failedCarriesError() {
        Result<Double> r = Result.failed(new NoDataException("No data found for XYZ"));
        assertFalse(r.isOk());
        assertEquals("No data found for XYZ", r.errorMessage());
        assertInstanceOf(NoDataException.class, r.error().orElseThrow());
        assertThrows(NoSuchElementException.class, r::value);
    }

    @Test
    void blankMessageFallsBackToType() {
        Result<String> r = Result.failed(new IllegalStateException());
        assertEquals("IllegalStateException", r.errorMessage());
    }

    @Test
    void mapOnlyTouchesSuccess() {
        assertEquals(Result.ok(3), Result.ok("abc").map(String::length));
        Result<Integer> failed = Result.<String>failed(new IllegalStateException("x")).map(String::length);
        assertFalse(failed.isOk());
        assertEquals("x", failed.errorMessage());
    }
}

package io.valuation.retry;

import io.valuation.error.NoDataException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {
    @Test
    void retriesTransientFailuresUpToMaxAttempts() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 100, 1000);
        IOException io = new IOException("connection reset");
        assertTrue(policy.shouldRetry(1, io));
        assertTrue(policy.shouldRetry(2, io));
        assertFalse(policy.shouldRetry(3, io));
    }

    @Test
    void neverRetriesAnEmptyAnswer() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(5, 100, 1000);
        assertFalse(policy.shouldRetry(1, new NoDataException("No data found for XYZ")));
    }

    @Test
    void backoffDoublesAndIsCapped() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(10, 100, 1000);
        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(400, policy.backoffMillis(3));
        assertEquals(800, policy.backoffMillis(4));
        assertEquals(1000, policy.backoffMillis(5));
        assertEquals(1000, policy.backoffMillis(60));
    }

    @Test
    void noneNeverRetries() {
        assertFalse(RetryPolicy.none().shouldRetry(1, new IOException()));
        assertEquals(0, RetryPolicy.none().backoffMillis(1));
    }

    @Test
    void atLeastOneAttempt() {
        assertEquals(1, new ExponentialBackoffRetryPolicy(0, 1, 1).maxAttempts());
    }
}

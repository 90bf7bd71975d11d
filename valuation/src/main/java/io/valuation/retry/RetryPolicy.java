package io.valuation.retry;

/**
 * Decides whether a failed external call is attempted again, and after how long.
 * Attempts are numbered from 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    /** Single attempt, no retries. */
    static RetryPolicy none() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0L; }
        };
    }
}

package io.refdata.retry;

public interface RetryPolicy {
    /** Total attempts allowed, the first one included. */
    int maxAttempts();
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);
}

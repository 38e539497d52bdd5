package io.refdata.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_delay_until_cap() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(5, 100, 350);
        assertEquals(100, p.backoffMillis(1));
        assertEquals(200, p.backoffMillis(2));
        assertEquals(350, p.backoffMillis(3));
        assertEquals(350, p.backoffMillis(30));
    }

    @Test
    void stops_at_max_attempts() {
        RetryPolicy p = new ExponentialBackoffRetryPolicy(3, 1, 10);
        assertEquals(3, p.maxAttempts());
        assertTrue(p.shouldRetry(1, new IOException("x")));
        assertTrue(p.shouldRetry(2, new IOException("x")));
        assertFalse(p.shouldRetry(3, new IOException("x")));
    }

    @Test
    void predicate_limits_what_is_retried() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(3, 1, 10, e -> e instanceof IOException);
        assertTrue(p.shouldRetry(1, new IOException("io")));
        assertFalse(p.shouldRetry(1, new IllegalStateException("bug")));
        assertEquals(3, p.maxAttempts());
    }

    @Test
    void clamps_nonsense_arguments() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(0, -5, -1);
        assertEquals(1, p.maxAttempts());
        assertEquals(0, p.backoffMillis(1));
        assertFalse(p.shouldRetry(1, new IOException("x")));
    }
}

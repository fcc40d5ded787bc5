package com.graphflow.node;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void none_neverRetries() {
        assertFalse(RetryPolicy.none().shouldRetry(1, new RuntimeException()));
    }

    @Test
    void shouldRetry_untilMaximumAttempts() {
        RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofMillis(10));
        assertTrue(policy.shouldRetry(1, new RuntimeException()));
        assertTrue(policy.shouldRetry(2, new RuntimeException()));
        assertFalse(policy.shouldRetry(3, new RuntimeException()));
    }

    @Test
    void shouldRetry_nonRetryableBySimpleOrFullName() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ZERO, 2.0, Duration.ZERO,
                List.of("IllegalArgumentException", "java.lang.ArithmeticException"));
        assertFalse(policy.shouldRetry(1, new IllegalArgumentException()));
        assertFalse(policy.shouldRetry(1, new ArithmeticException()));
        assertTrue(policy.shouldRetry(1, new IllegalStateException()));
    }

    @Test
    void shouldRetry_reportedErrorsHonorFlagAndType() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO, List.of("QuotaExceeded"));
        assertTrue(policy.shouldRetry(1, ErrorInfo.of("Timeout", "slow")));
        assertFalse(policy.shouldRetry(1, ErrorInfo.nonRetryable("Timeout", "slow")));
        assertFalse(policy.shouldRetry(1, ErrorInfo.of("QuotaExceeded", "limit")));
    }

    @Test
    void delayBefore_growsExponentiallyAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), 2.0, Duration.ofMillis(350), List.of());
        assertEquals(Duration.ZERO, policy.delayBefore(1));
        assertEquals(Duration.ofMillis(100), policy.delayBefore(2));
        assertEquals(Duration.ofMillis(200), policy.delayBefore(3));
        assertEquals(Duration.ofMillis(350), policy.delayBefore(4));
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(2, Duration.ZERO, 0.5, Duration.ZERO, List.of()));
    }
}

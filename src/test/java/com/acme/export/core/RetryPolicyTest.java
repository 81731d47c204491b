package com.acme.export.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private RetryPolicy policy(double jitter) {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30), () -> jitter);
    }

    @Test
    void testPermanentNeverRetries() {
        RetryDecision decision = policy(1.0).decide(FailureKind.PERMANENT, 1);

        assertFalse(decision.retry());
    }

    @Test
    void testTransientBacksOffExponentially() {
        RetryPolicy policy = policy(1.0);

        assertEquals(Duration.ofSeconds(1), policy.decide(FailureKind.TRANSIENT, 1).delay());
        assertEquals(Duration.ofSeconds(2), policy.decide(FailureKind.TRANSIENT, 2).delay());
        assertEquals(Duration.ofSeconds(4), policy.decide(FailureKind.TRANSIENT, 3).delay());
        assertEquals(Duration.ofSeconds(8), policy.decide(FailureKind.TRANSIENT, 4).delay());
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        RetryPolicy policy = policy(1.0);

        assertTrue(policy.decide(FailureKind.TRANSIENT, 4).retry());
        assertFalse(policy.decide(FailureKind.TRANSIENT, 5).retry());
        assertFalse(policy.decide(FailureKind.RATE_LIMITED, 5).retry());
    }

    @Test
    void testDelayIsCappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(100, Duration.ofSeconds(1), Duration.ofSeconds(30), () -> 1.0);

        assertEquals(Duration.ofSeconds(16), policy.backoffCeiling(5));
        assertEquals(Duration.ofSeconds(30), policy.backoffCeiling(6));
        assertEquals(Duration.ofSeconds(30), policy.backoffCeiling(64));
        assertEquals(Duration.ofSeconds(30), policy.decide(FailureKind.TRANSIENT, 80).delay());
    }

    @Test
    void testFullJitterStaysWithinCeiling() {
        assertEquals(Duration.ZERO, policy(0.0).decide(FailureKind.TRANSIENT, 3).delay());
        assertEquals(Duration.ofMillis(2000), policy(0.5).decide(FailureKind.TRANSIENT, 3).delay());

        RetryPolicy random = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30));
        for (int i = 0; i < 200; i++) {
            Duration delay = random.decide(FailureKind.RATE_LIMITED, 3).delay();
            assertFalse(delay.isNegative());
            assertTrue(delay.compareTo(Duration.ofSeconds(4)) <= 0);
        }
    }

    @Test
    void testRateLimitedHonorsRetryAfterWithinCap() {
        RetryPolicy policy = policy(0.0);

        assertEquals(Duration.ofSeconds(7), policy.decide(FailureKind.RATE_LIMITED, 1, Duration.ofSeconds(7)).delay());
        assertEquals(Duration.ofSeconds(30), policy.decide(FailureKind.RATE_LIMITED, 1, Duration.ofMinutes(5)).delay());
        // Retry-After only applies to rate limiting
        assertEquals(Duration.ZERO, policy.decide(FailureKind.TRANSIENT, 1, Duration.ofSeconds(7)).delay());
    }

    @Test
    void testRejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofSeconds(-1), Duration.ofSeconds(1)));
    }
}

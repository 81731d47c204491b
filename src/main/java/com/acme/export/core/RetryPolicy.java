package com.acme.export.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed attempt is retried and how long to back off.
 * <p>
 * Permanent failures never retry. Rate-limited and transient failures retry until
 * {@code maxAttempts} attempts have been made, waiting a uniformly random time in
 * {@code [0, min(maxDelay, baseDelay * 2^(attempt-1))]}.
 */
public class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.random = random;
    }

    public RetryDecision decide(FailureKind kind, int attemptsSoFar) {
        return decide(kind, attemptsSoFar, null);
    }

    /**
     * @param attemptsSoFar attempts already made for the item, including the one that just failed
     * @param retryAfter    server supplied minimum delay, or null
     */
    public RetryDecision decide(FailureKind kind, int attemptsSoFar, Duration retryAfter) {
        if (kind == FailureKind.PERMANENT || attemptsSoFar >= maxAttempts) {
            return RetryDecision.giveUp();
        }
        long ceiling = backoffCeiling(attemptsSoFar).toMillis();
        long delay = Math.round(ceiling * random.getAsDouble());
        if (retryAfter != null && kind == FailureKind.RATE_LIMITED) {
            delay = Math.min(Math.max(delay, retryAfter.toMillis()), maxDelay.toMillis());
        }
        return RetryDecision.retryAfter(Duration.ofMillis(Math.max(0, delay)));
    }

    /** Upper bound of the jittered delay after the given attempt: base * 2^(attempt-1), capped. */
    public Duration backoffCeiling(int attempt) {
        int exponent = Math.min(Math.max(attempt, 1) - 1, 30);
        long base = baseDelay.toMillis();
        if (base > (maxDelay.toMillis() >> exponent)) {
            return maxDelay;
        }
        return Duration.ofMillis(base << exponent);
    }
}

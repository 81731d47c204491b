package com.acme.export.core;

import java.util.function.LongSupplier;

/**
 * Token bucket with capacity {@code C} refilled continuously at {@code R} tokens per second.
 * <p>
 * Admission reserves a token under the lock (the balance may go negative, which is a
 * reservation of future refill) and then waits the exact time until that token is due,
 * outside the lock. Waiters are therefore served in reservation order and never wait
 * longer than their reservation.
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;
    private final Object lock = new Object();

    private double tokens;
    private long lastRefill;

    public TokenBucketRateLimiter(int capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    TokenBucketRateLimiter(int capacity, double refillPerSecond, LongSupplier nanoClock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (!(refillPerSecond > 0)) {
            throw new IllegalArgumentException("refillPerSecond must be > 0");
        }
        this.capacity = capacity;
        this.tokensPerNano = refillPerSecond / NANOS_PER_SECOND;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefill = nanoClock.getAsLong();
    }

    @Override
    public void admit(CancellationToken token) {
        token.throwIfCancelled();
        long waitNanos = reserve();
        if (waitNanos > 0 && !token.sleep(waitNanos)) {
            throw new CancelledException("Cancelled while waiting for admission");
        }
    }

    @Override
    public void penalize() {
        synchronized (lock) {
            refill();
            if (tokens > 0) {
                tokens = 0;
            }
        }
    }

    /**
     * Takes one token and returns how long the caller must wait before using it.
     */
    long reserve() {
        synchronized (lock) {
            refill();
            tokens -= 1;
            if (tokens >= 0) {
                return 0;
            }
            return (long) Math.ceil(-tokens / tokensPerNano);
        }
    }

    double availableTokens() {
        synchronized (lock) {
            refill();
            return tokens;
        }
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefill = now;
        }
    }
}

package com.acme.export.core;

import java.time.Duration;
import java.util.Optional;

/**
 * The remote source explicitly rejected a request for exceeding its rate budget.
 */
public class RateLimitedException extends TransientException {
    private final Duration retryAfter;

    public RateLimitedException(String message) {
        this(message, null);
    }

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /** Server supplied Retry-After, if any. */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}

package com.acme.export.config;

import com.acme.export.core.RateLimiter;
import com.acme.export.core.RetryPolicy;
import com.acme.export.core.TokenBucketRateLimiter;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * The request budget and the retry policy are shared by every run in the process.
 */
@Factory
public class ExportFactory {

    @Singleton
    public RateLimiter rateLimiter(ExportConfig config) {
        return new TokenBucketRateLimiter(config.getRate().getCapacity(), config.getRate().getRefillPerSecond());
    }

    @Singleton
    public RetryPolicy retryPolicy(ExportConfig config) {
        var retry = config.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
    }
}

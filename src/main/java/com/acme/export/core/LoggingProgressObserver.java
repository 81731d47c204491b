package com.acme.export.core;

import com.acme.export.spi.ProgressObserver;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
@Secondary
public class LoggingProgressObserver implements ProgressObserver {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressObserver.class);
    private static final int EVERY = 10;

    private final AtomicLong seen = new AtomicLong();

    @Override
    public void onItemOutcome(WorkItem item, ItemOutcome outcome) {
        long n = seen.incrementAndGet();
        if (outcome.status() == ItemOutcome.Status.FAILED) {
            LOG.warn("Item {} failed ({}): {}", item, outcome.failureKind(), outcome.reason());
        }
        if (n % EVERY == 0) {
            LOG.info("Processed {} item(s)", n);
        }
    }
}

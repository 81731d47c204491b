package com.acme.export.core;

import com.acme.export.spi.ProgressObserver;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands outcomes to the observer on its own thread so a slow or failing observer never
 * holds up a worker.
 */
final class ProgressDispatcher implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ProgressDispatcher.class);
    private static final Duration DRAIN_WAIT = Duration.ofSeconds(2);

    private final ProgressObserver observer;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "export-progress");
        t.setDaemon(true);
        return t;
    });

    ProgressDispatcher(ProgressObserver observer) {
        this.observer = observer;
    }

    void dispatch(ItemOutcome outcome) {
        try {
            executor.execute(() -> notifyObserver(outcome));
        } catch (RejectedExecutionException e) {
            LOG.debug("Progress dispatcher closed, dropping outcome for item {}", outcome.item());
        }
    }

    private void notifyObserver(ItemOutcome outcome) {
        try {
            observer.onItemOutcome(outcome.item(), outcome);
        } catch (RuntimeException e) {
            LOG.warn("Progress observer failed for item {}: {}", outcome.item(), e.toString());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.debug("Progress observer still busy after {} ms, not waiting for it", DRAIN_WAIT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

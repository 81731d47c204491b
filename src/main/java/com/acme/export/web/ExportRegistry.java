package com.acme.export.web;

import com.acme.export.config.ExportConfig;
import com.acme.export.core.CancellationToken;
import com.acme.export.core.ExportOrchestrator;
import com.acme.export.core.ExportOverrides;
import com.acme.export.core.ExportRun;
import com.acme.export.core.OwnerContext;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs exports in the background, at most one active run per owner, and keeps the latest
 * run of each owner for status queries until {@code export.run-retention} after it finished.
 */
@Singleton
public class ExportRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ExportRegistry.class);

    private final ExportOrchestrator orchestrator;
    private final ExportConfig config;
    private final Map<String, ExportRun> runs = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public ExportRegistry(ExportOrchestrator orchestrator, ExportConfig config) {
        this.orchestrator = orchestrator;
        this.config = config;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "export-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ExportRun start(OwnerContext owner, int concurrency, ExportOverrides overrides) {
        if (concurrency < 1 || concurrency > config.getMaxConcurrency()) {
            throw new IllegalArgumentException("concurrency must be between 1 and " + config.getMaxConcurrency());
        }
        var run = new ExportRun(owner, new CancellationToken());
        ExportRun active = runs.compute(owner.ownerId(),
                (id, previous) -> previous != null && !previous.phase().isTerminal() ? previous : run);
        if (active != run) {
            throw new ExportAlreadyRunningException(owner.ownerId());
        }
        executor.execute(() -> {
            try {
                orchestrator.execute(run, concurrency, overrides);
            } catch (RuntimeException e) {
                // already recorded on the run and logged by the orchestrator
                LOG.debug("Export run for owner {} ended with {}", owner.ownerId(), e.toString());
            }
        });
        return run;
    }

    @Scheduled(fixedDelay = "1m")
    void evictFinished() {
        evictFinishedBefore(Instant.now().minus(config.getRunRetention()));
    }

    /**
     * Drops finished runs that ended before the cutoff. Active runs are never evicted.
     */
    int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, ExportRun> entry : runs.entrySet()) {
            Instant finished = entry.getValue().finishedAt();
            if (finished != null && finished.isBefore(cutoff) && runs.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} finished export run(s)", evicted);
        }
        return evicted;
    }

    public Optional<ExportRun> find(OwnerContext owner) {
        return Optional.ofNullable(runs.get(owner.ownerId()));
    }

    /**
     * @return true if an active run was found and asked to stop
     */
    public boolean cancel(OwnerContext owner) {
        ExportRun run = runs.get(owner.ownerId());
        if (run == null || run.phase().isTerminal()) {
            return false;
        }
        LOG.info("Cancelling export for owner {}", owner.ownerId());
        run.cancel();
        return true;
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down export registry");
        runs.values().forEach(ExportRun::cancel);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Export runs still finishing in-flight items at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

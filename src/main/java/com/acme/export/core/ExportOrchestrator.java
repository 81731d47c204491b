package com.acme.export.core;

import com.acme.export.config.ExportConfig;
import com.acme.export.spi.ArtifactWriter;
import com.acme.export.spi.Discoverer;
import com.acme.export.spi.ProgressObserver;
import com.acme.export.spi.RecordFetcher;
import com.acme.export.spi.StateStore;
import com.acme.export.spi.StateStoreFactory;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one export run per call: discover, compute the pending set against the owner's
 * completion state, execute the pending items and finalize the state.
 * <p>
 * Run-level failures ({@link DiscoveryException}, {@link CorruptStateException}) abort the
 * run before any item is processed and are rethrown. Item-level failures are reported in the
 * {@link ExportSummary}. A run cancelled during discovery ends CANCELLED without touching the state.
 */
@Singleton
public class ExportOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(ExportOrchestrator.class);

    private final Discoverer discoverer;
    private final RecordFetcher fetcher;
    private final ArtifactWriter writer;
    private final StateStoreFactory stateStores;
    private final ProgressObserver observer;
    private final WorkerPool workerPool;
    private final ExportConfig config;

    public ExportOrchestrator(Discoverer discoverer, RecordFetcher fetcher, ArtifactWriter writer,
                              StateStoreFactory stateStores, ProgressObserver observer,
                              WorkerPool workerPool, ExportConfig config) {
        this.discoverer = discoverer;
        this.fetcher = fetcher;
        this.writer = writer;
        this.stateStores = stateStores;
        this.observer = observer;
        this.workerPool = workerPool;
        this.config = config;
    }

    public ExportSummary startExport(OwnerContext owner, int concurrency, ExportOverrides overrides) {
        return startExport(owner, concurrency, overrides, new CancellationToken());
    }

    public ExportSummary startExport(OwnerContext owner, int concurrency, ExportOverrides overrides, CancellationToken token) {
        return execute(new ExportRun(owner, token), concurrency, overrides);
    }

    public ExportSummary execute(ExportRun run, int concurrency, ExportOverrides overrides) {
        if (concurrency < 1 || concurrency > config.getMaxConcurrency()) {
            throw new IllegalArgumentException("concurrency must be between 1 and " + config.getMaxConcurrency());
        }
        OwnerContext owner = run.owner();
        CancellationToken token = run.token();
        long started = System.nanoTime();
        if (config.getRunTimeout() != null) {
            token.cancelAfter(config.getRunTimeout());
        }
        try {
            run.transition(ExportPhase.DISCOVERING);
            List<WorkItem> discovered = discover(owner, token);
            LOG.info("Discovered {} item(s) for owner {}", discovered.size(), owner.ownerId());

            run.transition(ExportPhase.COMPUTING_PENDING);
            StateStore store = stateStores.open(owner);
            store.load();
            applyOverrides(store, overrides, owner);
            store.recordDiscovered(discovered);
            List<WorkItem> pending = pendingSet(discovered, store.snapshot());
            int skipped = discovered.size() - pending.size();
            if (pending.isEmpty()) {
                store.flush();
                LOG.info("No new items to export for owner {} ({} already done)", owner.ownerId(), skipped);
                ExportSummary summary = ExportSummary.nothingToDo(owner.ownerId(), discovered.size(), skipped, elapsedMillis(started));
                run.complete(summary);
                return summary;
            }
            LOG.info("Exporting {} pending item(s) for owner {} with concurrency {} ({} already done)",
                    pending.size(), owner.ownerId(), concurrency, skipped);

            run.transition(ExportPhase.EXECUTING);
            List<ItemOutcome> outcomes;
            try (var dispatcher = new ProgressDispatcher(observer);
                 var unit = new ExportUnitOfWork(owner, fetcher, writer, store, config.getFetchTimeout())) {
                outcomes = workerPool.run(pending, unit, concurrency, token, dispatcher::dispatch);
            }
            boolean cancelled = token.isCancelled();

            run.transition(ExportPhase.FINALIZING);
            store.flush();
            ExportSummary summary = summarize(owner, cancelled ? ExportPhase.CANCELLED : ExportPhase.COMPLETED,
                    discovered.size(), skipped, outcomes, elapsedMillis(started));
            LOG.info("Export for owner {} {}: {} succeeded, {} failed, {} skipped, {} not attempted",
                    owner.ownerId(), summary.phase(), summary.succeededCount(), summary.failedCount(),
                    summary.skipped(), summary.notAttempted().size());
            if (!summary.failed().isEmpty()) {
                LOG.warn("Failed items for owner {}: {}", owner.ownerId(), summary.failedIds());
            }
            run.complete(summary);
            return summary;
        } catch (CancelledException e) {
            LOG.info("Export for owner {} cancelled during {}", owner.ownerId(), run.phase());
            ExportSummary summary = ExportSummary.cancelledBeforeWork(owner.ownerId(), elapsedMillis(started));
            run.complete(summary);
            return summary;
        } catch (RuntimeException e) {
            LOG.error("Export for owner {} failed in phase {}: {}", owner.ownerId(), run.phase(), e.getMessage());
            run.fail(e);
            throw e;
        }
    }

    private List<WorkItem> discover(OwnerContext owner, CancellationToken token) {
        List<WorkItem> discovered;
        try {
            discovered = discoverer.listAllIdentifiers(owner, token);
        } catch (DiscoveryException | CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DiscoveryException("Discovery failed for owner " + owner.ownerId() + ": " + Failures.describe(e), e);
        }
        if (discovered == null) {
            throw new DiscoveryException("Discovery returned no listing for owner " + owner.ownerId());
        }
        return discovered.stream().distinct().toList();
    }

    private static void applyOverrides(StateStore store, ExportOverrides overrides, OwnerContext owner) {
        switch (overrides.mode()) {
            case FORCE_ALL -> {
                LOG.info("Clearing all completion state for owner {}", owner.ownerId());
                store.clear();
            }
            case FORCE_SUBSET -> {
                LOG.info("Clearing completion state of {} item(s) for owner {}", overrides.ids().size(), owner.ownerId());
                store.remove(overrides.ids());
            }
            case NONE -> {
            }
        }
    }

    /** discovered minus done, identifier descending. */
    static List<WorkItem> pendingSet(List<WorkItem> discovered, ExportState state) {
        return discovered.stream()
                .filter(item -> !state.isDone(item))
                .sorted(Comparator.reverseOrder())
                .toList();
    }

    private static ExportSummary summarize(OwnerContext owner, ExportPhase phase, int discovered, int skipped,
                                           List<ItemOutcome> outcomes, long elapsedMillis) {
        var succeeded = new ArrayList<WorkItem>();
        var failed = new ArrayList<ItemOutcome>();
        var notAttempted = new ArrayList<WorkItem>();
        for (ItemOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCEEDED -> succeeded.add(outcome.item());
                case FAILED -> failed.add(outcome);
                case CANCELLED -> notAttempted.add(outcome.item());
            }
        }
        return new ExportSummary(owner.ownerId(), phase, discovered, skipped, succeeded, failed, notAttempted, elapsedMillis);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}

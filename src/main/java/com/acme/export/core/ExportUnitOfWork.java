package com.acme.export.core;

import com.acme.export.spi.ArtifactWriter;
import com.acme.export.spi.RecordFetcher;
import com.acme.export.spi.StateStore;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * fetch/convert (bounded by the fetch timeout), write the artifact, then mark the item done.
 * The item is only marked done after the writer returned.
 */
final class ExportUnitOfWork implements WorkerPool.UnitOfWork, AutoCloseable {
    private final OwnerContext owner;
    private final RecordFetcher fetcher;
    private final ArtifactWriter writer;
    private final StateStore store;
    private final Duration fetchTimeout;
    private final ExecutorService fetchExecutor;

    ExportUnitOfWork(OwnerContext owner, RecordFetcher fetcher, ArtifactWriter writer, StateStore store, Duration fetchTimeout) {
        this.owner = owner;
        this.fetcher = fetcher;
        this.writer = writer;
        this.store = store;
        this.fetchTimeout = fetchTimeout;
        var counter = new AtomicInteger();
        this.fetchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "export-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(WorkItem item) throws Exception {
        Artifact artifact = fetch(item);
        writer.write(owner, item, artifact);
        store.markDone(item);
    }

    private Artifact fetch(WorkItem item) throws Exception {
        Future<Artifact> call = fetchExecutor.submit(() -> fetcher.fetchAndConvert(owner, item));
        try {
            Artifact artifact = call.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (artifact == null) {
                throw new PermanentException("Empty record for item " + item);
            }
            return artifact;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TransientException("Fetch of item " + item + " timed out after " + fetchTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while fetching item " + item, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }
}

package com.acme.export.core;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on one export run: its phase, its cancellation token and its eventual summary.
 */
public final class ExportRun {
    private final OwnerContext owner;
    private final CancellationToken token;
    private final Instant startedAt = Instant.now();
    private final CompletableFuture<ExportSummary> completion = new CompletableFuture<>();
    private volatile ExportPhase phase = ExportPhase.IDLE;
    private volatile String error;
    private volatile Instant finishedAt;

    public ExportRun(OwnerContext owner, CancellationToken token) {
        this.owner = owner;
        this.token = token;
    }

    public OwnerContext owner() {
        return owner;
    }

    public CancellationToken token() {
        return token;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ExportPhase phase() {
        return phase;
    }

    /** Message of the run-level failure, when the run ended in {@link ExportPhase#FAILED}. */
    public String error() {
        return error;
    }

    /** When the run reached a terminal phase, or null while it is active. */
    public Instant finishedAt() {
        return finishedAt;
    }

    public CompletableFuture<ExportSummary> completion() {
        return completion;
    }

    public ExportSummary summary() {
        return completion.isDone() && !completion.isCompletedExceptionally() ? completion.join() : null;
    }

    public void cancel() {
        token.cancel();
    }

    void transition(ExportPhase next) {
        phase = next;
    }

    void complete(ExportSummary summary) {
        phase = summary.phase();
        finishedAt = Instant.now();
        completion.complete(summary);
    }

    void fail(Throwable cause) {
        error = Failures.describe(cause);
        phase = ExportPhase.FAILED;
        finishedAt = Instant.now();
        completion.completeExceptionally(cause);
    }
}

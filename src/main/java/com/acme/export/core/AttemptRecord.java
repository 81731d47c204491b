package com.acme.export.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-item retry bookkeeping within one run. Owned by a single worker thread.
 */
final class AttemptRecord {
    private final WorkItem item;
    private int attempts;
    private FailureKind lastFailure;
    private String lastError;
    private Instant nextEligibleAt;

    AttemptRecord(WorkItem item) {
        this.item = item;
    }

    void begin() {
        attempts++;
        nextEligibleAt = null;
    }

    void failed(FailureKind kind, String error) {
        lastFailure = kind;
        lastError = error;
    }

    void scheduleNext(Duration delay) {
        nextEligibleAt = Instant.now().plus(delay);
    }

    WorkItem item() {
        return item;
    }

    int attempts() {
        return attempts;
    }

    FailureKind lastFailure() {
        return lastFailure;
    }

    String lastError() {
        return lastError;
    }

    Instant nextEligibleAt() {
        return nextEligibleAt;
    }
}

package com.acme.export.core;

/**
 * Final result of one work item within one run.
 */
public record ItemOutcome(WorkItem item, Status status, int attempts, FailureKind failureKind, String reason) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /** Never reached a terminal state because the run was cancelled; picked up by the next run. */
        CANCELLED
    }

    public static ItemOutcome succeeded(WorkItem item, int attempts) {
        return new ItemOutcome(item, Status.SUCCEEDED, attempts, null, null);
    }

    public static ItemOutcome failed(WorkItem item, int attempts, FailureKind kind, String reason) {
        return new ItemOutcome(item, Status.FAILED, attempts, kind, reason);
    }

    public static ItemOutcome cancelled(WorkItem item, int attempts) {
        return new ItemOutcome(item, Status.CANCELLED, attempts, null, "cancelled");
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}

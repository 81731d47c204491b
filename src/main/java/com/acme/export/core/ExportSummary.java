package com.acme.export.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * What one export run did. Failed outcomes carry id and reason so a targeted
 * force-subset re-run is possible.
 */
public record ExportSummary(
        String ownerId,
        ExportPhase phase,
        int discovered,
        int skipped,
        List<WorkItem> succeeded,
        List<ItemOutcome> failed,
        List<WorkItem> notAttempted,
        long elapsedMillis) {

    public ExportSummary {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
        notAttempted = List.copyOf(notAttempted);
    }

    public static ExportSummary nothingToDo(String ownerId, int discovered, int skipped, long elapsedMillis) {
        return new ExportSummary(ownerId, ExportPhase.COMPLETED, discovered, skipped, List.of(), List.of(), List.of(), elapsedMillis);
    }

    public static ExportSummary cancelledBeforeWork(String ownerId, long elapsedMillis) {
        return new ExportSummary(ownerId, ExportPhase.CANCELLED, 0, 0, List.of(), List.of(), List.of(), elapsedMillis);
    }

    @JsonProperty("succeededCount")
    public int succeededCount() {
        return succeeded.size();
    }

    @JsonProperty("failedCount")
    public int failedCount() {
        return failed.size();
    }

    public List<WorkItem> failedIds() {
        return failed.stream().map(ItemOutcome::item).toList();
    }
}

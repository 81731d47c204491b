package com.acme.export.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Durable completion record of one owner. Immutable; every mutation yields a new snapshot.
 */
@JsonPropertyOrder({"version", "done_ids", "discovered_ids"})
public record ExportState(
        @JsonProperty("version") int version,
        @JsonProperty("done_ids") SortedSet<WorkItem> doneIds,
        @JsonProperty("discovered_ids") SortedSet<WorkItem> discoveredIds) {

    public static final int CURRENT_VERSION = 3;

    public ExportState {
        doneIds = Collections.unmodifiableSortedSet(doneIds == null ? new TreeSet<>() : new TreeSet<>(doneIds));
        discoveredIds = Collections.unmodifiableSortedSet(discoveredIds == null ? new TreeSet<>() : new TreeSet<>(discoveredIds));
    }

    public static ExportState empty() {
        return new ExportState(CURRENT_VERSION, null, null);
    }

    public boolean isDone(WorkItem item) {
        return doneIds.contains(item);
    }

    public ExportState withDone(WorkItem item) {
        var next = new TreeSet<>(doneIds);
        next.add(item);
        return new ExportState(version, next, discoveredIds);
    }

    public ExportState without(Set<WorkItem> items) {
        var next = new TreeSet<>(doneIds);
        next.removeAll(items);
        return new ExportState(version, next, discoveredIds);
    }

    public ExportState cleared() {
        return new ExportState(version, null, discoveredIds);
    }

    public ExportState withDiscovered(Collection<WorkItem> items) {
        var next = new TreeSet<>(discoveredIds);
        next.addAll(items);
        return new ExportState(version, doneIds, next);
    }

    @JsonIgnore
    public int doneCount() {
        return doneIds.size();
    }
}

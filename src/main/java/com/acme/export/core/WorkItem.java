package com.acme.export.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable identifier of one remote record (a workout). Serialised as a bare number.
 */
public record WorkItem(long id) implements Comparable<WorkItem> {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WorkItem of(long id) {
        return new WorkItem(id);
    }

    @JsonValue
    @Override
    public long id() {
        return id;
    }

    @Override
    public int compareTo(WorkItem other) {
        return Long.compare(id, other.id);
    }

    @Override
    public String toString() {
        return Long.toString(id);
    }
}

package com.acme.export.core;

import java.util.Objects;
import java.util.Set;

/**
 * Operator overrides applied to the completion state before the pending set is computed.
 */
public record ExportOverrides(Mode mode, Set<WorkItem> ids) {

    public enum Mode {
        /** Normal incremental run. */
        NONE,
        /** Clear all completion state first. */
        FORCE_ALL,
        /** Clear completion state of the named ids only. */
        FORCE_SUBSET
    }

    private static final ExportOverrides NONE = new ExportOverrides(Mode.NONE, Set.of());
    private static final ExportOverrides FORCE_ALL = new ExportOverrides(Mode.FORCE_ALL, Set.of());

    public ExportOverrides {
        Objects.requireNonNull(mode, "mode");
        ids = ids == null ? Set.of() : Set.copyOf(ids);
        if (mode == Mode.FORCE_SUBSET && ids.isEmpty()) {
            throw new IllegalArgumentException("forceSubset requires at least one id");
        }
    }

    public static ExportOverrides none() {
        return NONE;
    }

    public static ExportOverrides forceAll() {
        return FORCE_ALL;
    }

    public static ExportOverrides forceSubset(Set<WorkItem> ids) {
        return new ExportOverrides(Mode.FORCE_SUBSET, ids);
    }
}

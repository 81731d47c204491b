package com.acme.export.spi;

import com.acme.export.core.ExportState;
import com.acme.export.core.WorkItem;
import java.util.Collection;
import java.util.Set;

/**
 * Completion state of one owner. Every mutation is serialized against the others
 * and durably persisted before it returns.
 */
public interface StateStore {

    /**
     * @throws com.acme.export.core.CorruptStateException if the stored form cannot be parsed
     */
    ExportState load();

    boolean isDone(WorkItem item);

    void markDone(WorkItem item);

    void remove(Set<WorkItem> items);

    void clear();

    void recordDiscovered(Collection<WorkItem> items);

    /** Persists the current snapshot. A no-op when every mutation was already persisted. */
    void flush();

    ExportState snapshot();
}

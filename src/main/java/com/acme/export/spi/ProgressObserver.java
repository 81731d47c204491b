package com.acme.export.spi;

import com.acme.export.core.ItemOutcome;
import com.acme.export.core.WorkItem;

/**
 * Fire-and-forget progress notifications. Called off the worker threads.
 */
public interface ProgressObserver {
    void onItemOutcome(WorkItem item, ItemOutcome outcome);
}

package com.acme.export.web;

import com.acme.export.core.ExportOverrides;
import com.acme.export.core.WorkItem;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Body of {@code POST /exports/{ownerId}}. Every field is optional.
 */
public record ExportRequest(Integer concurrency, Boolean forceAll, List<Long> forceIds) {

    public int concurrencyOr(int defaultConcurrency) {
        return concurrency == null ? defaultConcurrency : concurrency;
    }

    public ExportOverrides overrides() {
        if (Boolean.TRUE.equals(forceAll)) {
            if (forceIds != null && !forceIds.isEmpty()) {
                throw new IllegalArgumentException("forceAll and forceIds are mutually exclusive");
            }
            return ExportOverrides.forceAll();
        }
        if (forceIds != null && !forceIds.isEmpty()) {
            return ExportOverrides.forceSubset(forceIds.stream().map(WorkItem::of).collect(Collectors.toSet()));
        }
        return ExportOverrides.none();
    }
}

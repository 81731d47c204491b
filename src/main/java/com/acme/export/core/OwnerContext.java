package com.acme.export.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The owner whose records are exported (e.g. an athlete). The id names the owner's
 * state and output directories, so it is restricted to a safe path segment.
 */
public record OwnerContext(String ownerId) {
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    public OwnerContext {
        Objects.requireNonNull(ownerId, "ownerId");
        if (!SAFE.matcher(ownerId).matches() || ownerId.equals(".") || ownerId.equals("..")) {
            throw new IllegalArgumentException("Invalid owner id: " + ownerId);
        }
    }

    public static OwnerContext of(String ownerId) {
        return new OwnerContext(ownerId);
    }
}

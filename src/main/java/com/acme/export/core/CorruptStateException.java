package com.acme.export.core;

import java.nio.file.Path;

/**
 * The persisted export state exists but cannot be read. Must be resolved by the operator;
 * the file is never discarded automatically.
 */
public class CorruptStateException extends RuntimeException {
    private final Path path;

    public CorruptStateException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

package com.acme.export.core;

import java.util.Map;

/**
 * Output of converting one remote record: the file to write plus free-form metadata.
 */
public record Artifact(String fileName, byte[] content, Map<String, String> metadata) {

    public Artifact {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName is required");
        }
        content = content == null ? new byte[0] : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

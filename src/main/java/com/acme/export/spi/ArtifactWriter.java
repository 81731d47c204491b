package com.acme.export.spi;

import com.acme.export.core.Artifact;
import com.acme.export.core.OwnerContext;
import com.acme.export.core.WorkItem;

public interface ArtifactWriter {

    /**
     * Durably writes the artifact. Returns only once the bytes are on disk.
     * Failures are transient unless the target path itself is invalid.
     */
    void write(OwnerContext owner, WorkItem item, Artifact artifact);
}

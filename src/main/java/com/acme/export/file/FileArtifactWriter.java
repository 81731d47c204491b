package com.acme.export.file;

import com.acme.export.config.ExportConfig;
import com.acme.export.core.Artifact;
import com.acme.export.core.OwnerContext;
import com.acme.export.core.PermanentException;
import com.acme.export.core.TransientException;
import com.acme.export.core.WorkItem;
import com.acme.export.spi.ArtifactWriter;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes artifacts to {@code <output-dir>/<owner-id>/<file-name>}, replacing any earlier copy,
 * so re-processing an item is idempotent.
 */
@Singleton
public class FileArtifactWriter implements ArtifactWriter {
    private static final Logger LOG = LoggerFactory.getLogger(FileArtifactWriter.class);

    private final Path outputDir;

    public FileArtifactWriter(ExportConfig config) {
        this.outputDir = config.getOutputDirPath().toAbsolutePath().normalize();
    }

    @Override
    public void write(OwnerContext owner, WorkItem item, Artifact artifact) {
        Path target = resolve(owner, artifact.fileName());
        try {
            AtomicFiles.write(target, artifact.content());
            LOG.debug("Wrote {} ({} bytes) for item {}", target, artifact.content().length, item);
        } catch (IOException e) {
            throw new TransientException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    Path resolve(OwnerContext owner, String fileName) {
        Path ownerDir = outputDir.resolve(owner.ownerId());
        try {
            Path target = ownerDir.resolve(fileName).normalize();
            if (!target.getParent().equals(ownerDir)) {
                throw new PermanentException("Artifact file name escapes the output directory: " + fileName);
            }
            return target;
        } catch (InvalidPathException e) {
            throw new PermanentException("Invalid artifact file name: " + fileName, e);
        }
    }
}

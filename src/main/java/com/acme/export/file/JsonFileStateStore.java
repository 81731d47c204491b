package com.acme.export.file;

import com.acme.export.core.CorruptStateException;
import com.acme.export.core.ExportState;
import com.acme.export.core.Jsons;
import com.acme.export.core.WorkItem;
import com.acme.export.spi.StateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one owner's {@link ExportState} in a JSON file.
 * <p>
 * Mutations are serialized by a single lock. Each one writes the next state to a temp file
 * in the same directory, forces it to disk and atomically renames it over the canonical
 * file; only then is the new state published in memory. A crash at any point leaves the
 * canonical file holding either the previous or the next complete state.
 * <p>
 * Versions 1 and 2 use the legacy {@code done_wids}/{@code discovered_wids} keys and are
 * migrated on load.
 */
public class JsonFileStateStore implements StateStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    public static final String FILE_NAME = "export-state.json";

    private final Path file;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile ExportState current;
    private ExportState persisted;

    public JsonFileStateStore(Path file) {
        this.file = file.toAbsolutePath().normalize();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public ExportState load() {
        writeLock.lock();
        try {
            if (!Files.exists(file)) {
                LOG.debug("No export state at {}, starting empty", file);
                current = ExportState.empty();
                persisted = null;
                return current;
            }
            ExportState state = decode(read());
            persisted = state;
            if (state.version() < ExportState.CURRENT_VERSION) {
                ExportState migrated = new ExportState(ExportState.CURRENT_VERSION, state.doneIds(), state.discoveredIds());
                persist(migrated);
                LOG.info("Migrated export state {} from version {} to {}", file, state.version(), ExportState.CURRENT_VERSION);
                state = migrated;
            }
            current = state;
            return state;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isDone(WorkItem item) {
        return requireLoaded().isDone(item);
    }

    @Override
    public void markDone(WorkItem item) {
        mutate(s -> s.withDone(item));
    }

    @Override
    public void remove(Set<WorkItem> items) {
        mutate(s -> s.without(items));
    }

    @Override
    public void clear() {
        mutate(ExportState::cleared);
    }

    @Override
    public void recordDiscovered(Collection<WorkItem> items) {
        mutate(s -> s.withDiscovered(items));
    }

    @Override
    public void flush() {
        writeLock.lock();
        try {
            ExportState state = requireLoaded();
            if (state != persisted) {
                persist(state);
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public ExportState snapshot() {
        return requireLoaded();
    }

    private void mutate(UnaryOperator<ExportState> change) {
        writeLock.lock();
        try {
            ExportState base = requireLoaded();
            ExportState next = change.apply(base);
            if (next.equals(base) && persisted != null) {
                return;
            }
            persist(next);
            current = next;
        } finally {
            writeLock.unlock();
        }
    }

    private ExportState requireLoaded() {
        ExportState state = current;
        if (state == null) {
            throw new IllegalStateException("Export state not loaded: " + file);
        }
        return state;
    }

    private byte[] read() {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export state " + file, e);
        }
    }

    private void persist(ExportState state) {
        try {
            AtomicFiles.write(file, Jsons.toBytes(state));
            persisted = state;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist export state " + file, e);
        }
    }

    private ExportState decode(byte[] bytes) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new CorruptStateException(file, "Export state is not valid JSON", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export state " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptStateException(file, "Export state is not a JSON object", null);
        }
        JsonNode versionNode = root.get("version");
        if (versionNode != null && !versionNode.canConvertToInt()) {
            throw new CorruptStateException(file, "Export state version is not a number", null);
        }
        int version = versionNode == null ? 1 : versionNode.asInt();
        if (version < 1 || version > ExportState.CURRENT_VERSION) {
            throw new CorruptStateException(file, "Unsupported export state version " + version, null);
        }
        boolean legacy = version < 3;
        var done = ids(root, legacy ? "done_wids" : "done_ids");
        var discovered = ids(root, legacy ? "discovered_wids" : "discovered_ids");
        return new ExportState(version, done, discovered);
    }

    private TreeSet<WorkItem> ids(JsonNode root, String field) {
        var ids = new TreeSet<WorkItem>();
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return ids;
        }
        if (!node.isArray()) {
            throw new CorruptStateException(file, "Field " + field + " is not an array", null);
        }
        for (JsonNode element : node) {
            if (!element.isIntegralNumber() || !element.canConvertToLong()) {
                throw new CorruptStateException(file, "Field " + field + " holds a non-integer id " + element, null);
            }
            ids.add(WorkItem.of(element.asLong()));
        }
        return ids;
    }
}

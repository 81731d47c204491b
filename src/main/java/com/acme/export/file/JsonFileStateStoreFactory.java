package com.acme.export.file;

import com.acme.export.config.ExportConfig;
import com.acme.export.core.OwnerContext;
import com.acme.export.spi.StateStore;
import com.acme.export.spi.StateStoreFactory;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One store instance per owner, at {@code <state-dir>/<owner-id>/export-state.json}.
 */
@Singleton
public class JsonFileStateStoreFactory implements StateStoreFactory {
    private final ExportConfig config;
    private final Map<String, JsonFileStateStore> stores = new ConcurrentHashMap<>();

    public JsonFileStateStoreFactory(ExportConfig config) {
        this.config = config;
    }

    @Override
    public StateStore open(OwnerContext owner) {
        return stores.computeIfAbsent(owner.ownerId(), id -> new JsonFileStateStore(
                config.getStateDirPath().resolve(id).resolve(JsonFileStateStore.FILE_NAME)));
    }
}

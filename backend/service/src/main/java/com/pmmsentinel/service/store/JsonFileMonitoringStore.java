package com.pmmsentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmmsentinel.core.util.JsonUtils;
import com.pmmsentinel.engine.store.InMemoryMonitoringStore;
import com.pmmsentinel.engine.store.StoreState;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link InMemoryMonitoringStore} that rewrites one pretty-printed JSON state file after every
 * mutation and reloads it on construction.
 */
public class JsonFileMonitoringStore extends InMemoryMonitoringStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;

    public JsonFileMonitoringStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    public Path file() {
        return file;
    }

    @Override
    protected void afterWrite(String recordKind) {
        Path parent = file.toAbsolutePath().getParent();
        Path staging = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(staging)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, exportState());
            }
            Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing " + recordKind + " to " + file, e);
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            importState(MAPPER.readValue(in, StoreState.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading monitoring state from " + file, e);
        }
    }
}

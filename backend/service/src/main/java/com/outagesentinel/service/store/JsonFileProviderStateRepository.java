package com.outagesentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outagesentinel.core.model.PersistedProviderState;
import com.outagesentinel.core.util.JsonUtils;
import com.outagesentinel.detector.api.ProviderStateRepository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Hysteresis state kept in one pretty-printed JSON document,
 * {@code {"providers": {"<name>": {...}}}}. Content that cannot be read back is treated
 * as absent so a damaged file only costs the affected providers their streaks.
 */
public class JsonFileProviderStateRepository implements ProviderStateRepository {
    private static final Logger LOGGER = Logger.getLogger(JsonFileProviderStateRepository.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PersistedProviderState> providers = new TreeMap<>();

    public JsonFileProviderStateRepository(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public Optional<PersistedProviderState> get(String provider) {
        lock.lock();
        try {
            return Optional.ofNullable(providers.get(provider));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String provider, PersistedProviderState state) {
        lock.lock();
        try {
            providers.put(provider, state);
            persist();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, PersistedProviderState> snapshot() {
        lock.lock();
        try {
            return Map.copyOf(providers);
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            LOGGER.warning(() -> "Ignoring unreadable provider state in " + file + ": " + e.getMessage());
            return;
        }
        JsonNode entries = root == null ? null : root.get("providers");
        if (entries == null || !entries.isObject()) {
            LOGGER.warning(() -> "Ignoring provider state in " + file + ": no providers object");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                PersistedProviderState state = MAPPER.treeToValue(entry.getValue(), PersistedProviderState.class);
                if (state != null) {
                    providers.put(entry.getKey(), state);
                }
            } catch (IOException | IllegalArgumentException e) {
                LOGGER.warning(() -> "Resetting state for " + entry.getKey() + ": " + e.getMessage());
            }
        }
    }

    private void persist() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(tmp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new StateFile(new TreeMap<>(providers)));
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing provider state to " + file, e);
        }
    }

    private record StateFile(Map<String, PersistedProviderState> providers) {
    }
}

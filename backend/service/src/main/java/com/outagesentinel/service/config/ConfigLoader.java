package com.outagesentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.core.model.ProviderDefinition;
import com.outagesentinel.core.util.JsonUtils;
import com.outagesentinel.detector.config.DetectorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    static final String DETECTOR_FILE = "detector.json";
    static final String DETECTOR_EXAMPLE_FILE = "detector.example.json";
    static final String AGGREGATOR_FILE = "aggregator.json";

    private ConfigLoader() {
    }

    public static DetectorConfig loadDetector(Path configDir) {
        Path primary = configDir.resolve(DETECTOR_FILE);
        if (Files.exists(primary)) {
            return read(primary, new TypeReference<>() {
            });
        }
        Path example = configDir.resolve(DETECTOR_EXAMPLE_FILE);
        if (Files.exists(example)) {
            LOGGER.info(() -> "No " + DETECTOR_FILE + " in " + configDir + ", using " + DETECTOR_EXAMPLE_FILE);
            return read(example, new TypeReference<>() {
            });
        }
        throw new IllegalStateException("No detector config found in " + configDir);
    }

    /**
     * Reads every provider file named in the detector config, in config order. Paths are
     * resolved against {@code configDir}. Missing or unreadable files are skipped; at least
     * one must load.
     */
    public static List<ProviderDefinition> loadProviders(Path configDir, DetectorConfig config) {
        List<ProviderDefinition> providers = new ArrayList<>();
        int resolved = 0;
        for (Map.Entry<String, String> group : config.providers().entrySet()) {
            Path path = configDir.resolve(group.getValue());
            if (!Files.exists(path)) {
                LOGGER.warning(() -> "Provider list '" + group.getKey() + "' not found at " + path + ", skipping");
                continue;
            }
            try {
                List<ProviderDefinition> definitions = read(path, new TypeReference<>() {
                });
                if (definitions != null) {
                    providers.addAll(definitions);
                }
                resolved++;
            } catch (IllegalStateException e) {
                LOGGER.warning(() -> "Provider list '" + group.getKey() + "' at " + path
                        + " is unreadable, skipping: " + e.getCause().getMessage());
            }
        }
        if (resolved == 0) {
            throw new IllegalStateException("No provider list could be loaded from " + configDir
                    + " (configured: " + config.providers().values() + ")");
        }
        return List.copyOf(providers);
    }

    public static AggregatorConfig loadAggregator(Path configDir) {
        Path path = configDir.resolve(AGGREGATOR_FILE);
        if (!Files.exists(path)) {
            return AggregatorConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}

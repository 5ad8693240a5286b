package com.raditha.loopchain.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the converter configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults
 * <pre>
 * loop_to_call_chain:
 *   preset: strict            # optional, ignores the other keys
 *   max_chain_calls: 2
 *   assume_non_null: true
 *   use_method_references: false
 * </pre>
 */
public class LoopChainSettings {

    private static final String CONFIG_KEY = "loop_to_call_chain";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private LoopChainSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile         the YAML file, null when there is none
     * @param maxChainCallsCLI   CLI maximum chain length (0 = use YAML/default)
     * @param assumeNonNullCLI   CLI nullability assumption (null = use YAML/default)
     * @return complete configuration
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid YAML or holds invalid values
     */
    public static LoopChainConfig loadConfig(@Nullable Path configFile, int maxChainCallsCLI,
                                             @Nullable Boolean assumeNonNullCLI) throws IOException {
        Map<String, Object> config = readSection(configFile);
        if (config == null) {
            return createFromCLI(maxChainCallsCLI, assumeNonNullCLI);
        }

        String preset = getString(config, "preset", null);
        if (preset != null) {
            return fromPreset(preset);
        }

        LoopChainConfig defaults = LoopChainConfig.defaults();
        int maxChainCalls = maxChainCallsCLI != 0
                ? maxChainCallsCLI
                : getInt(config, "max_chain_calls", defaults.maxChainCallCount());
        boolean assumeNonNull = assumeNonNullCLI != null
                ? assumeNonNullCLI
                : getBoolean(config, "assume_non_null", defaults.assumeNonNull());
        boolean useMethodReferences = getBoolean(config, "use_method_references", defaults.useMethodReferences());

        return new LoopChainConfig(maxChainCalls, assumeNonNull, useMethodReferences);
    }

    private static LoopChainConfig createFromCLI(int maxChainCallsCLI, @Nullable Boolean assumeNonNullCLI) {
        LoopChainConfig defaults = LoopChainConfig.defaults();
        return new LoopChainConfig(
                maxChainCallsCLI != 0 ? maxChainCallsCLI : defaults.maxChainCallCount(),
                assumeNonNullCLI != null ? assumeNonNullCLI : defaults.assumeNonNull(),
                defaults.useMethodReferences());
    }

    private static LoopChainConfig fromPreset(String preset) {
        return switch (preset) {
            case "strict" -> LoopChainConfig.strict();
            case "default" -> LoopChainConfig.defaults();
            default -> throw new IllegalArgumentException(
                    "Invalid preset: " + preset + ". Must be: default or strict");
        };
    }

    private static @Nullable Map<String, Object> readSection(@Nullable Path configFile) throws IOException {
        if (configFile == null || !Files.exists(configFile)) {
            return null;
        }
        JsonNode root;
        try {
            root = YAML.readTree(configFile.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getOriginalMessage(), e);
        }
        // an empty file holds no document at all
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode section = root.get(CONFIG_KEY);
        if (section == null || !section.isObject()) {
            return null;
        }
        return YAML.convertValue(section, new TypeReference<Map<String, Object>>() {
        });
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value instanceof String) {
            return (String) value;
        }
        return defaultValue;
    }
}

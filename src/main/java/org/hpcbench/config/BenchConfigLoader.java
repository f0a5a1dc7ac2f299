package org.hpcbench.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads orchestrator configuration files (YAML or JSON) layered over the bundled defaults.
 */
public final class BenchConfigLoader {
    static final String DEFAULTS_RESOURCE = "/hpcbench-defaults.yaml";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
        "target", "storageDir", "resultsDir", "workingDirectory", "stagingDir",
        "polling", "connectivity", "regression");
    private static final Set<String> POLLING_KEYS = Set.of(
        "jobInterval", "runningTimeout", "endpointTimeout", "endpointInitialDelay", "endpointMaxDelay");
    private static final Set<String> CONNECTIVITY_KEYS = Set.of("maxAttempts", "initialDelay", "maxDelay");
    private static final Set<String> REGRESSION_KEYS = Set.of("latency_pct", "throughput_pct", "success_rate_pct");

    private BenchConfigLoader() {}

    public static BenchConfig loadDefaults() {
        BenchConfig.Builder builder = BenchConfig.builder();
        apply(builder, readDefaults());
        return builder.build();
    }

    public static BenchConfig load(final Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new ConfigurationException("config path must be an existing file: " + normalized);
        }
        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    static BenchConfig parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        final Map<String, Object> overrides = normalizedName.endsWith(".json")
                ? parseJson(content)
                : parseYaml(content, sourceName);

        final BenchConfig.Builder builder = BenchConfig.builder();
        apply(builder, readDefaults());
        apply(builder, overrides);
        return builder.build();
    }

    private static Map<String, Object> readDefaults() {
        try (InputStream input = BenchConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (input == null) {
                return Map.of();
            }
            return parseYaml(new String(input.readAllBytes(), StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    private static Map<String, Object> parseJson(final String content) {
        try {
            return new LinkedHashMap<>(Document.parse(content));
        } catch (JsonParseException e) {
            throw new ConfigurationException("config is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parseYaml(final String content, final String sourceName) {
        final Object root;
        try {
            root = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new ConfigurationException("config is not valid YAML (" + sourceName + "): " + e.getMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ConfigurationException("config root must be an object: " + sourceName);
        }
        return stringKeys(rawMap, "config root");
    }

    private static void apply(final BenchConfig.Builder builder, final Map<String, Object> values) {
        requireKnownKeys(values, TOP_LEVEL_KEYS, "config");
        if (values.containsKey("target")) {
            builder.target(text(values.get("target"), "target"));
        }
        if (values.containsKey("storageDir")) {
            builder.storageDir(Path.of(text(values.get("storageDir"), "storageDir")));
        }
        if (values.containsKey("resultsDir")) {
            builder.resultsDir(Path.of(text(values.get("resultsDir"), "resultsDir")));
        }
        if (values.containsKey("workingDirectory")) {
            builder.workingDirectory(text(values.get("workingDirectory"), "workingDirectory"));
        }
        if (values.containsKey("stagingDir")) {
            builder.stagingDir(Path.of(text(values.get("stagingDir"), "stagingDir")));
        }

        final Map<String, Object> polling = section(values, "polling", POLLING_KEYS);
        if (polling.containsKey("jobInterval")) {
            builder.jobPollInterval(duration(polling.get("jobInterval"), "polling.jobInterval"));
        }
        if (polling.containsKey("runningTimeout")) {
            builder.runningTimeout(duration(polling.get("runningTimeout"), "polling.runningTimeout"));
        }
        if (polling.containsKey("endpointTimeout")) {
            builder.endpointTimeout(duration(polling.get("endpointTimeout"), "polling.endpointTimeout"));
        }
        if (polling.containsKey("endpointInitialDelay")) {
            builder.endpointInitialDelay(duration(polling.get("endpointInitialDelay"), "polling.endpointInitialDelay"));
        }
        if (polling.containsKey("endpointMaxDelay")) {
            builder.endpointMaxDelay(duration(polling.get("endpointMaxDelay"), "polling.endpointMaxDelay"));
        }

        final Map<String, Object> connectivity = section(values, "connectivity", CONNECTIVITY_KEYS);
        if (connectivity.containsKey("maxAttempts")) {
            builder.connectivityMaxAttempts((int) number(connectivity.get("maxAttempts"), "connectivity.maxAttempts"));
        }
        if (connectivity.containsKey("initialDelay")) {
            builder.connectivityInitialDelay(duration(connectivity.get("initialDelay"), "connectivity.initialDelay"));
        }
        if (connectivity.containsKey("maxDelay")) {
            builder.connectivityMaxDelay(duration(connectivity.get("maxDelay"), "connectivity.maxDelay"));
        }

        final Map<String, Object> regression = section(values, "regression", REGRESSION_KEYS);
        for (final Map.Entry<String, Object> entry : regression.entrySet()) {
            builder.regressionThreshold(entry.getKey(), number(entry.getValue(), "regression." + entry.getKey()));
        }
    }

    private static Map<String, Object> section(
            final Map<String, Object> values, final String name, final Set<String> allowedKeys) {
        final Object raw = values.get(name);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> rawMap)) {
            throw new ConfigurationException(name + " must be an object");
        }
        final Map<String, Object> section = stringKeys(rawMap, name);
        requireKnownKeys(section, allowedKeys, name);
        return section;
    }

    private static Map<String, Object> stringKeys(final Map<?, ?> rawMap, final String context) {
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            if (entry.getKey() == null) {
                throw new ConfigurationException(context + " contains a null key");
            }
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }

    private static void requireKnownKeys(
            final Map<String, Object> values, final Set<String> allowedKeys, final String context) {
        for (final String key : values.keySet()) {
            if (!allowedKeys.contains(key)) {
                throw new ConfigurationException("unknown key in " + context + ": " + key);
            }
        }
    }

    private static String text(final Object value, final String fieldName) {
        if (value == null || String.valueOf(value).isBlank()) {
            throw new ConfigurationException(fieldName + " must not be blank");
        }
        return String.valueOf(value).trim();
    }

    private static double number(final Object value, final String fieldName) {
        if (value instanceof Number numeric && Double.isFinite(numeric.doubleValue())) {
            return numeric.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(fieldName + " must be numeric: " + text, e);
            }
        }
        throw new ConfigurationException(fieldName + " must be numeric");
    }

    /**
     * Durations are numbers of seconds or ISO-8601 strings such as {@code PT30S}.
     */
    static Duration duration(final Object value, final String fieldName) {
        if (value instanceof String text && text.trim().toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(text.trim().toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException(fieldName + " is not an ISO-8601 duration: " + text, e);
            }
        }
        final double seconds = number(value, fieldName);
        return Duration.ofMillis(Math.round(seconds * 1000.0d));
    }
}

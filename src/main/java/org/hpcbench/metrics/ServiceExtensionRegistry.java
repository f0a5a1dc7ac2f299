package org.hpcbench.metrics;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps {@code service_type} values to their {@link ServiceExtension}. New service kinds are added by
 * registration.
 */
public final class ServiceExtensionRegistry {
    private final Map<String, ServiceExtension> extensions = new LinkedHashMap<>();

    public static ServiceExtensionRegistry empty() {
        return new ServiceExtensionRegistry();
    }

    /**
     * Registry with the built-in extensions: {@code vllm} and {@code ollama} (token rates),
     * {@code postgres} and {@code redis} (per-operation breakdown).
     */
    public static ServiceExtensionRegistry defaults() {
        final GenerativeInferenceExtension inference = new GenerativeInferenceExtension();
        return new ServiceExtensionRegistry()
                .register("vllm", inference)
                .register("ollama", inference)
                .register("postgres", OperationBreakdownExtension.relational())
                .register("redis", OperationBreakdownExtension.keyValue());
    }

    public ServiceExtensionRegistry register(final String serviceType, final ServiceExtension extension) {
        Objects.requireNonNull(extension, "extension");
        extensions.put(normalize(serviceType), extension);
        return this;
    }

    public Optional<ServiceExtension> find(final String serviceType) {
        if (serviceType == null || serviceType.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(normalize(serviceType)));
    }

    public Set<String> serviceTypes() {
        return Set.copyOf(extensions.keySet());
    }

    private static String normalize(final String serviceType) {
        if (serviceType == null || serviceType.trim().isEmpty()) {
            throw new IllegalArgumentException("serviceType must not be blank");
        }
        return serviceType.trim().toLowerCase(Locale.ROOT);
    }
}

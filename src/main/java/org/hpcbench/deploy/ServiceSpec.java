package org.hpcbench.deploy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.hpcbench.config.ConfigurationException;

/**
 * Deployment request for one service: image, start command, port and scheduler resources.
 */
public final class ServiceSpec {
    static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final String name;
    private final String containerImage;
    private final String command;
    private final Integer port;
    private final Map<String, String> environment;
    private final Map<String, Object> resources;
    private final boolean waitForStart;
    private final Duration runningTimeout;
    private final Map<String, Object> metadata;

    private ServiceSpec(final Builder builder) {
        this.name = requireName(builder.name);
        this.containerImage = requireText(builder.containerImage, "service.container_image");
        this.command = requireText(builder.command, "service.command");
        if (builder.port != null && (builder.port < 1 || builder.port > 65535)) {
            throw new ConfigurationException("service.port must be between 1 and 65535: " + builder.port);
        }
        this.port = builder.port;
        this.environment = Map.copyOf(builder.environment);
        this.resources = Map.copyOf(builder.resources);
        this.waitForStart = builder.waitForStart;
        if (builder.runningTimeout != null && (builder.runningTimeout.isZero() || builder.runningTimeout.isNegative())) {
            throw new ConfigurationException("service.running_timeout must be positive");
        }
        this.runningTimeout = builder.runningTimeout;
        this.metadata = Map.copyOf(builder.metadata);
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String containerImage() {
        return containerImage;
    }

    public String command() {
        return command;
    }

    public Optional<Integer> port() {
        return Optional.ofNullable(port);
    }

    public Map<String, String> environment() {
        return environment;
    }

    /**
     * Scheduler directives such as {@code partition}, {@code time} or {@code gres}.
     */
    public Map<String, Object> resources() {
        return resources;
    }

    public boolean waitForStart() {
        return waitForStart;
    }

    public Optional<Duration> runningTimeout() {
        return Optional.ofNullable(runningTimeout);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    static String requireName(final String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new ConfigurationException("deployment name must match " + NAME_PATTERN.pattern() + ": " + name);
        }
        return name;
    }

    static String requireText(final String value, final String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException(fieldName + " is required");
        }
        return value.trim();
    }

    public static final class Builder {
        private final String name;
        private String containerImage;
        private String command;
        private Integer port;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private final Map<String, Object> resources = new LinkedHashMap<>();
        private boolean waitForStart = true;
        private Duration runningTimeout;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(final String name) {
            this.name = name;
        }

        public Builder containerImage(final String containerImage) {
            this.containerImage = containerImage;
            return this;
        }

        public Builder command(final String command) {
            this.command = command;
            return this;
        }

        public Builder port(final Integer port) {
            this.port = port;
            return this;
        }

        public Builder environment(final String key, final String value) {
            this.environment.put(key, value);
            return this;
        }

        public Builder resource(final String key, final Object value) {
            this.resources.put(key, value);
            return this;
        }

        public Builder waitForStart(final boolean waitForStart) {
            this.waitForStart = waitForStart;
            return this;
        }

        public Builder runningTimeout(final Duration runningTimeout) {
            this.runningTimeout = runningTimeout;
            return this;
        }

        public Builder metadata(final String key, final Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public ServiceSpec build() {
            return new ServiceSpec(this);
        }
    }
}

package org.hpcbench.deploy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.hpcbench.config.ConfigurationException;

/**
 * Deployment request for one load-generating client.
 */
public final class ClientSpec {
    private final String name;
    private final String benchmarkCommand;
    private final Map<String, String> environment;
    private final Map<String, Object> resources;
    private final boolean waitForStart;
    private final Duration runningTimeout;
    private final Map<String, Object> metadata;

    private ClientSpec(final Builder builder) {
        this.name = ServiceSpec.requireName(builder.name);
        this.benchmarkCommand = ServiceSpec.requireText(builder.benchmarkCommand, "client.command");
        this.environment = Map.copyOf(builder.environment);
        this.resources = Map.copyOf(builder.resources);
        this.waitForStart = builder.waitForStart;
        if (builder.runningTimeout != null && (builder.runningTimeout.isZero() || builder.runningTimeout.isNegative())) {
            throw new ConfigurationException("client.running_timeout must be positive");
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

    public String benchmarkCommand() {
        return benchmarkCommand;
    }

    public Map<String, String> environment() {
        return environment;
    }

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

    /**
     * Same client under another name, optionally without its own running-wait.
     */
    public ClientSpec renamed(final String newName, final boolean waitForStart) {
        Builder builder = new Builder(newName)
                .benchmarkCommand(benchmarkCommand)
                .waitForStart(waitForStart)
                .runningTimeout(runningTimeout);
        builder.environment.putAll(environment);
        builder.resources.putAll(resources);
        builder.metadata.putAll(metadata);
        return builder.build();
    }

    public static final class Builder {
        private final String name;
        private String benchmarkCommand;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private final Map<String, Object> resources = new LinkedHashMap<>();
        private boolean waitForStart = true;
        private Duration runningTimeout;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(final String name) {
            this.name = name;
        }

        public Builder benchmarkCommand(final String benchmarkCommand) {
            this.benchmarkCommand = benchmarkCommand;
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

        public ClientSpec build() {
            return new ClientSpec(this);
        }
    }
}

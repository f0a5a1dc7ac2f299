package org.hpcbench.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrator configuration: storage locations, polling and retry policy, regression thresholds.
 */
public final class BenchConfig {
    public static final String CAMPAIGN_PLACEHOLDER = "{campaign}";

    private final String target;
    private final Path storageDir;
    private final Path resultsDir;
    private final String workingDirectory;
    private final Path stagingDir;
    private final Duration jobPollInterval;
    private final Duration runningTimeout;
    private final Duration endpointTimeout;
    private final Duration endpointInitialDelay;
    private final Duration endpointMaxDelay;
    private final int connectivityMaxAttempts;
    private final Duration connectivityInitialDelay;
    private final Duration connectivityMaxDelay;
    private final Map<String, Double> regressionThresholds;

    private BenchConfig(Builder builder) {
        this.target = requireText(builder.target, "target");
        this.storageDir = Objects.requireNonNull(builder.storageDir, "storageDir");
        this.resultsDir = Objects.requireNonNull(builder.resultsDir, "resultsDir");
        this.workingDirectory = requireText(builder.workingDirectory, "workingDirectory");
        this.stagingDir = Objects.requireNonNull(builder.stagingDir, "stagingDir");
        this.jobPollInterval = requirePositive(builder.jobPollInterval, "polling.jobInterval");
        this.runningTimeout = requirePositive(builder.runningTimeout, "polling.runningTimeout");
        this.endpointTimeout = requirePositive(builder.endpointTimeout, "polling.endpointTimeout");
        this.endpointInitialDelay = requirePositive(builder.endpointInitialDelay, "polling.endpointInitialDelay");
        this.endpointMaxDelay = requirePositive(builder.endpointMaxDelay, "polling.endpointMaxDelay");
        if (endpointMaxDelay.compareTo(endpointInitialDelay) < 0) {
            throw new ConfigurationException("polling.endpointMaxDelay must be >= polling.endpointInitialDelay");
        }
        if (builder.connectivityMaxAttempts < 1) {
            throw new ConfigurationException("connectivity.maxAttempts must be >= 1");
        }
        this.connectivityMaxAttempts = builder.connectivityMaxAttempts;
        this.connectivityInitialDelay = requirePositive(builder.connectivityInitialDelay, "connectivity.initialDelay");
        this.connectivityMaxDelay = requirePositive(builder.connectivityMaxDelay, "connectivity.maxDelay");
        this.regressionThresholds = Map.copyOf(builder.regressionThresholds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String target() {
        return target;
    }

    public Path storageDir() {
        return storageDir;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    /**
     * Remote working directory template; {@code {campaign}} is replaced by the campaign id.
     */
    public String workingDirectory() {
        return workingDirectory;
    }

    public String workingDirectoryFor(String campaignId) {
        return workingDirectory.replace(CAMPAIGN_PLACEHOLDER, requireText(campaignId, "campaignId"));
    }

    public Path stagingDir() {
        return stagingDir;
    }

    public Duration jobPollInterval() {
        return jobPollInterval;
    }

    public Duration runningTimeout() {
        return runningTimeout;
    }

    public Duration endpointTimeout() {
        return endpointTimeout;
    }

    public Duration endpointInitialDelay() {
        return endpointInitialDelay;
    }

    public Duration endpointMaxDelay() {
        return endpointMaxDelay;
    }

    public int connectivityMaxAttempts() {
        return connectivityMaxAttempts;
    }

    public Duration connectivityInitialDelay() {
        return connectivityInitialDelay;
    }

    public Duration connectivityMaxDelay() {
        return connectivityMaxDelay;
    }

    /**
     * Regression threshold overrides keyed by {@code latency_pct}, {@code throughput_pct} and
     * {@code success_rate_pct}.
     */
    public Map<String, Double> regressionThresholds() {
        return regressionThresholds;
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    private static Duration requirePositive(Duration value, String fieldName) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(fieldName + " must be a positive duration");
        }
        return value;
    }

    public static final class Builder {
        private String target = "cluster";
        private Path storageDir = Path.of(".benchmark_storage");
        private Path resultsDir = Path.of("results");
        private String workingDirectory = "~/benchmark_" + CAMPAIGN_PLACEHOLDER;
        private Path stagingDir = Path.of(System.getProperty("java.io.tmpdir"));
        private Duration jobPollInterval = Duration.ofSeconds(5);
        private Duration runningTimeout = Duration.ofSeconds(300);
        private Duration endpointTimeout = Duration.ofSeconds(120);
        private Duration endpointInitialDelay = Duration.ofSeconds(1);
        private Duration endpointMaxDelay = Duration.ofSeconds(10);
        private int connectivityMaxAttempts = 3;
        private Duration connectivityInitialDelay = Duration.ofSeconds(1);
        private Duration connectivityMaxDelay = Duration.ofSeconds(8);
        private final Map<String, Double> regressionThresholds = new LinkedHashMap<>();

        private Builder() {}

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder storageDir(Path storageDir) {
            this.storageDir = storageDir;
            return this;
        }

        public Builder resultsDir(Path resultsDir) {
            this.resultsDir = resultsDir;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder stagingDir(Path stagingDir) {
            this.stagingDir = stagingDir;
            return this;
        }

        public Builder jobPollInterval(Duration jobPollInterval) {
            this.jobPollInterval = jobPollInterval;
            return this;
        }

        public Builder runningTimeout(Duration runningTimeout) {
            this.runningTimeout = runningTimeout;
            return this;
        }

        public Builder endpointTimeout(Duration endpointTimeout) {
            this.endpointTimeout = endpointTimeout;
            return this;
        }

        public Builder endpointInitialDelay(Duration endpointInitialDelay) {
            this.endpointInitialDelay = endpointInitialDelay;
            return this;
        }

        public Builder endpointMaxDelay(Duration endpointMaxDelay) {
            this.endpointMaxDelay = endpointMaxDelay;
            return this;
        }

        public Builder connectivityMaxAttempts(int connectivityMaxAttempts) {
            this.connectivityMaxAttempts = connectivityMaxAttempts;
            return this;
        }

        public Builder connectivityInitialDelay(Duration connectivityInitialDelay) {
            this.connectivityInitialDelay = connectivityInitialDelay;
            return this;
        }

        public Builder connectivityMaxDelay(Duration connectivityMaxDelay) {
            this.connectivityMaxDelay = connectivityMaxDelay;
            return this;
        }

        public Builder regressionThreshold(String key, double value) {
            this.regressionThresholds.put(key, value);
            return this;
        }

        public BenchConfig build() {
            return new BenchConfig(this);
        }
    }
}

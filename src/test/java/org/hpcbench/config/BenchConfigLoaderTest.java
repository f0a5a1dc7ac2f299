package org.hpcbench.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BenchConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromBundledResource() {
        BenchConfig config = BenchConfigLoader.loadDefaults();

        assertEquals("cluster", config.target());
        assertEquals(Path.of("results"), config.resultsDir());
        assertEquals(Duration.ofSeconds(5), config.jobPollInterval());
        assertEquals(Duration.ofSeconds(300), config.runningTimeout());
        assertEquals(3, config.connectivityMaxAttempts());
        assertEquals(10.0d, config.regressionThresholds().get("latency_pct"));
        assertEquals("~/benchmark_bench-7", config.workingDirectoryFor("bench-7"));
    }

    @Test
    void yamlOverridesAreLayeredOverDefaults() throws IOException {
        Path file = tempDir.resolve("bench.yaml");
        Files.writeString(file, String.join("\n",
            "target: meluxina",
            "workingDirectory: /scratch/{campaign}",
            "polling:",
            "  jobInterval: 0.5",
            "  endpointTimeout: PT2M",
            "regression:",
            "  latency_pct: 25",
            ""), StandardCharsets.UTF_8);

        BenchConfig config = BenchConfigLoader.load(file);

        assertEquals("meluxina", config.target());
        assertEquals("/scratch/bench-1", config.workingDirectoryFor("bench-1"));
        assertEquals(Duration.ofMillis(500), config.jobPollInterval());
        assertEquals(Duration.ofMinutes(2), config.endpointTimeout());
        assertEquals(Duration.ofSeconds(300), config.runningTimeout());
        assertEquals(25.0d, config.regressionThresholds().get("latency_pct"));
        assertEquals(10.0d, config.regressionThresholds().get("throughput_pct"));
    }

    @Test
    void jsonFilesAreAccepted() {
        BenchConfig config = BenchConfigLoader.parse("{\"connectivity\": {\"maxAttempts\": 5}}", "bench.json");

        assertEquals(5, config.connectivityMaxAttempts());
    }

    @Test
    void rejectsUnknownKeysAndInvalidValues() {
        ConfigurationException unknown = assertThrows(
            ConfigurationException.class,
            () -> BenchConfigLoader.parse("polling:\n  jobIntervall: 3\n", "bench.yaml"));
        assertTrue(unknown.getMessage().contains("jobIntervall"));

        assertThrows(
            ConfigurationException.class,
            () -> BenchConfigLoader.parse("polling:\n  jobInterval: 0\n", "bench.yaml"));
        assertThrows(
            ConfigurationException.class,
            () -> BenchConfigLoader.parse("regression:\n  latency_pct: lots\n", "bench.yaml"));
        assertThrows(
            ConfigurationException.class,
            () -> BenchConfigLoader.parse("- just\n- a list\n", "bench.yaml"));
        assertThrows(
            ConfigurationException.class,
            () -> BenchConfigLoader.parse("{not json", "bench.json"));
    }

    @Test
    void missingFileIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> BenchConfigLoader.load(tempDir.resolve("absent.yaml")));
    }

    @Test
    void endpointBackoffBoundsMustBeOrdered() {
        assertThrows(ConfigurationException.class, () -> BenchConfig.builder()
            .endpointInitialDelay(Duration.ofSeconds(10))
            .endpointMaxDelay(Duration.ofSeconds(1))
            .build());
    }
}

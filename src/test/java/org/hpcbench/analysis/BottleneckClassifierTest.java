package org.hpcbench.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.hpcbench.metrics.LatencyDistribution;
import org.hpcbench.metrics.Summary;
import org.junit.jupiter.api.Test;

class BottleneckClassifierTest {
    private final BottleneckClassifier classifier = new BottleneckClassifier();

    @Test
    void fastConsistentServiceIsHealthy() {
        Summary summary = summary(100, 100, 0, new LatencyDistribution(0.11, 0.05, 0.2, 0.02, 0.1, 0.13, 0.14, 0.15));

        BottleneckVerdict verdict = classifier.classify(summary);

        assertEquals(BottleneckCategory.HEALTHY, verdict.classification());
        assertEquals(Confidence.HIGH, verdict.confidence());
        assertEquals(3, verdict.scoreFor(BottleneckCategory.HEALTHY));
        assertEquals(List.of("System operating within normal parameters"), verdict.evidence());
        assertEquals(BottleneckCategory.HEALTHY.recommendations(), verdict.recommendations());
    }

    @Test
    void overloadedServiceIsQueueing() {
        Summary summary = Summary.builder()
            .counts(100, 90, 10)
            .successRate(90.0d)
            .serviceType("generic")
            .latency(new LatencyDistribution(0.6, 0.1, 4.0, 0.8, 0.2, 1.5, 2.0, 2.5))
            .requestsPerSecond(12.0d)
            .error("timeout", 10)
            .build();

        BottleneckVerdict verdict = classifier.classify(summary);

        assertEquals(BottleneckCategory.QUEUEING, verdict.classification());
        assertEquals(Confidence.HIGH, verdict.confidence());
        assertEquals(10, verdict.scoreFor(BottleneckCategory.QUEUEING));
        assertEquals(4, verdict.evidence().size());
        assertEquals("High latency spread: P99/P50 = 12.5x (queueing indicator)", verdict.evidence().get(0));
        assertEquals(
            "Most likely bottleneck: Service Queueing/Overload. Primary indicator: " + verdict.evidence().get(0),
            verdict.summary());
    }

    @Test
    void gpuTelemetryDrivesComputeClassification() {
        Summary summary = summary(50, 50, 0, new LatencyDistribution(1.0, 0.9, 1.3, 0.1, 1.0, 1.1, 1.15, 1.2));
        ResourceTelemetry telemetry = ResourceTelemetry.fromMap(Map.of(
            "gpu", Map.of("gpu_utilization", 95, "memory_used_mb", 95000, "memory_total_mb", 100000)));

        BottleneckVerdict verdict = classifier.classify(summary, telemetry);

        assertEquals(BottleneckCategory.GPU_BOUND, verdict.classification());
        assertEquals(3, verdict.scoreFor(BottleneckCategory.GPU_BOUND));
        assertEquals(2, verdict.scoreFor(BottleneckCategory.MEMORY_BOUND));
        assertEquals(Confidence.MEDIUM, verdict.confidence());
    }

    @Test
    void tiesGoToEarlierCategory() {
        Summary summary = summary(50, 50, 0, new LatencyDistribution(1.0, 0.9, 1.3, 0.1, 1.0, 1.1, 1.15, 1.2));
        ResourceTelemetry telemetry = ResourceTelemetry.fromMap(Map.of(
            "gpu", Map.of("gpu_utilization", 20, "memory_used_mb", 1000, "memory_total_mb", 100000)));

        BottleneckVerdict verdict = classifier.classify(summary, telemetry);

        assertEquals(1, verdict.scoreFor(BottleneckCategory.CPU_BOUND));
        assertEquals(1, verdict.scoreFor(BottleneckCategory.NETWORK_IO));
        assertEquals(BottleneckCategory.CPU_BOUND, verdict.classification());
        assertEquals(Confidence.LOW, verdict.confidence());
        assertEquals(1, verdict.evidence().size());
    }

    @Test
    void emptySummaryIsUnknown() {
        BottleneckVerdict verdict = classifier.classify(Summary.empty());

        assertEquals(BottleneckCategory.UNKNOWN, verdict.classification());
        assertEquals(Confidence.LOW, verdict.confidence());
        assertEquals("Unable to analyze - No request data available for analysis", verdict.summary());
        assertTrue(verdict.scores().values().stream().allMatch(score -> score == 0));
        assertEquals(BottleneckCategory.scored().size(), verdict.scores().size());
    }

    @Test
    void nothingScoredIsUnknown() {
        BottleneckClassifier noRules = new BottleneckClassifier(List.of());
        Summary summary = summary(10, 10, 0, new LatencyDistribution(0.1, 0.1, 0.1, 0, 0.1, 0.1, 0.1, 0.1));

        BottleneckVerdict verdict = noRules.classify(summary);

        assertEquals(BottleneckCategory.UNKNOWN, verdict.classification());
        assertEquals("Most likely bottleneck: Unable to Determine (insufficient data for detailed analysis)",
            verdict.summary());
    }

    @Test
    void telemetryParsingTreatsEmptySectionsAsAbsent() {
        assertTrue(ResourceTelemetry.fromMap(null).isEmpty());
        assertTrue(ResourceTelemetry.fromMap(Map.of("gpu", Map.of(), "slurm", Map.of())).isEmpty());

        ResourceTelemetry job = ResourceTelemetry.fromMap(Map.of(
            "slurm", Map.of("max_rss_mb", 9000, "cpu_time_s", 95, "elapsed_s", 100)));
        assertFalse(job.gpu().isPresent());
        assertEquals(95.0d, job.job().orElseThrow().cpuEfficiencyPercent(), 1e-9);
    }

    @Test
    void verdictMapUsesCategoryKeys() {
        BottleneckVerdict verdict = classifier.classify(Summary.empty());

        Map<String, Object> map = verdict.toMap();
        assertEquals("unknown", map.get("classification"));
        assertEquals("low", map.get("confidence"));
        assertTrue(((Map<?, ?>) map.get("scores")).containsKey("network_io"));
    }

    @Test
    void evidenceRejectsUnknownCategoryAndNonPositiveWeight() {
        assertThrows(IllegalArgumentException.class, () -> new Evidence(BottleneckCategory.UNKNOWN, 1, "x"));
        assertThrows(IllegalArgumentException.class, () -> new Evidence(BottleneckCategory.HEALTHY, 0, "x"));
    }

    private static Summary summary(long total, long ok, long failed, LatencyDistribution latency) {
        return Summary.builder()
            .counts(total, ok, failed)
            .successRate(total == 0 ? 0.0d : ok * 100.0d / total)
            .serviceType("generic")
            .latency(latency)
            .requestsPerSecond(10.0d)
            .build();
    }
}

package org.hpcbench.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.hpcbench.obs.RecordingLogger;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {
    private static final double EPS = 1e-9d;

    private final RecordingLogger logger = new RecordingLogger();
    private final MetricsAggregator aggregator = new MetricsAggregator(ServiceExtensionRegistry.defaults(), logger);

    @Test
    void aggregatesInferenceRun() {
        Summary summary = aggregator.aggregate("bench-1", inferenceRun());

        assertFalse(summary.isEmpty());
        assertEquals(4L, summary.totalRequests());
        assertEquals(3L, summary.successfulRequests());
        assertEquals(1L, summary.failedRequests());
        assertEquals(75.0d, summary.successRate(), EPS);
        assertEquals("vllm", summary.serviceType());

        LatencyDistribution latency = summary.latency();
        assertEquals(1.0d, latency.avg(), EPS);
        assertEquals(0.5d, latency.min(), EPS);
        assertEquals(1.5d, latency.max(), EPS);
        assertEquals(0.5d, latency.std(), EPS);
        assertEquals(1.0d, latency.p50(), EPS);
        assertEquals(1.4d, latency.p90(), EPS);
        assertEquals(1.49d, latency.p99(), EPS);

        assertEquals(4.0d, summary.testDurationSeconds().getAsDouble(), EPS);
        assertEquals(100.0d, summary.testStartTime().getAsDouble(), EPS);
        assertEquals(104.0d, summary.testEndTime().getAsDouble(), EPS);
        assertEquals(1.0d, summary.requestsPerSecond(), EPS);
        assertEquals(Map.of("timeout", 1L), summary.errorSummary());
        assertEquals(8.0d, summary.parametricNumber("concurrent_requests").getAsDouble(), EPS);

        Document extensions = summary.extensions();
        assertEquals(30.0d, extensions.getDouble("tokens_per_second"), EPS);
        assertEquals(40.0d, extensions.getDouble("avg_output_tokens"), EPS);
        assertEquals(20.0d, extensions.getDouble("avg_input_tokens"), EPS);
    }

    @Test
    void sameRecordsInAnyOrderGiveEqualSummaries() {
        List<RequestRecord> reversed = new ArrayList<>(inferenceRun());
        Collections.reverse(reversed);

        assertEquals(aggregator.aggregate("bench-1", inferenceRun()), aggregator.aggregate("bench-1", reversed));
    }

    @Test
    void noRecordsGiveTheEmptySummary() {
        Summary summary = aggregator.aggregate("bench-1", List.of());

        assertTrue(summary.isEmpty());
        assertEquals(0L, summary.totalRequests());
        assertEquals(0.0d, summary.requestsPerSecond(), EPS);
        assertEquals("unknown", summary.serviceType());
        assertEquals(0.0d, summary.testDurationSeconds().getAsDouble(), EPS);
        assertEquals(Boolean.TRUE, summary.toDocument().get("empty"));
    }

    @Test
    void unidentifiableRecordsAreDropped() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            RequestRecord.of("request_id", "a", "success", true, "latency_s", 0.2d, "service_type", "vllm"),
            RequestRecord.of("success", true, "latency_s", 0.1d),
            RequestRecord.of("request_id", "c", "benchmark_id", "$BENCHMARK_ID", "success", true)));

        assertEquals(1L, summary.totalRequests());
        assertTrue(logger.hasMessage("dropped unidentifiable request records"));
    }

    @Test
    void missingTimestampsLeaveThroughputAtZero() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            RequestRecord.of("request_id", "a", "success", true, "latency_s", 0.2d, "service_type", "custom"),
            RequestRecord.of("request_id", "b", "success", 0, "error", "refused", "service_type", "custom")));

        assertEquals(0.0d, summary.requestsPerSecond(), EPS);
        assertTrue(summary.testDurationSeconds().isEmpty());
        assertEquals(50.0d, summary.successRate(), EPS);
        assertEquals(Map.of("refused", 1L), summary.errorSummary());
        assertTrue(summary.extensions().isEmpty());
    }

    @Test
    void blankServiceTypeAppliesNoExtension() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            RequestRecord.of("request_id", "r1", "success", true, "latency_s", 0.2d,
                "timestamp_start", 10.0d, "timestamp_end", 10.2d, "service_type", ""),
            RequestRecord.of("request_id", "r2", "success", true, "latency_s", 0.4d,
                "timestamp_start", 10.5d, "timestamp_end", 10.9d, "service_type", "  ")));

        assertEquals(2L, summary.totalRequests());
        assertEquals("", summary.serviceType());
        assertTrue(summary.extensions().isEmpty());
    }

    @Test
    void instantaneousRunUsesDurationFloor() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            RequestRecord.of("request_id", "a", "success", false, "timestamp_start", 50.0d, "service_type", "custom")));

        assertEquals(MetricsAggregator.MIN_DURATION_SECONDS, summary.testDurationSeconds().getAsDouble(), EPS);
        assertEquals(1.0d / MetricsAggregator.MIN_DURATION_SECONDS, summary.requestsPerSecond(), 1e-3d);
        assertEquals(Map.of("unknown", 1L), summary.errorSummary());
    }

    @Test
    void keyValueRunBreaksDownOperations() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            kv("get", 0.001d, 10.0d, 100),
            kv("get", 0.003d, 11.0d, 1000),
            kv("set", 0.002d, 12.0d, 100)));

        Document extensions = summary.extensions();
        Document operations = extensions.get("operations", Document.class);
        assertEquals(List.of("GET", "SET"), new ArrayList<>(operations.keySet()));
        Document get = operations.get("GET", Document.class);
        assertEquals(2L, ((Number) get.get("count")).longValue());
        assertEquals(0.002d, get.getDouble("avg_latency"), EPS);
        assertEquals(0.001d, get.getDouble("min_latency"), EPS);
        assertEquals(1.0d, get.getDouble("throughput"), EPS);
        assertEquals(400.0d, extensions.getDouble("avg_payload_size_bytes"), EPS);
        assertEquals(List.of(100L, 1000L), extensions.getList("payload_sizes_used", Long.class));
        assertEquals(summary.requestsPerSecond(), extensions.getDouble("transactions_per_second"), EPS);
        assertEquals(100.0d, summary.parametricNumber("payload_size_bytes").getAsDouble(), EPS);
    }

    @Test
    void relationalRunReportsAverageAndP95PerOperation() {
        Summary summary = aggregator.aggregate("bench-1", List.of(
            RequestRecord.of("request_id", "1", "service_type", "postgres", "operation_type", "select",
                "success", true, "latency_s", 0.01d),
            RequestRecord.of("request_id", "2", "service_type", "postgres", "operation_type", "select",
                "success", true, "latency_s", 0.03d)));

        Document select = summary.extensions().get("operations", Document.class).get("select", Document.class);
        assertEquals(0.02d, select.getDouble("avg_latency"), EPS);
        assertEquals(0.029d, select.getDouble("p95_latency"), EPS);
        assertFalse(select.containsKey("min_latency"));
    }

    static List<RequestRecord> inferenceRun() {
        return List.of(
            RequestRecord.of("request_id", "r1", "service_type", "vllm", "success", true, "latency_s", 0.5d,
                "timestamp_start", 100.0d, "timestamp_end", 100.5d, "output_tokens", 50, "input_tokens", 10,
                "concurrent_requests", 8),
            RequestRecord.of("request_id", "r2", "service_type", "vllm", "success", true, "latency_s", 1.0d,
                "timestamp_start", 100.2d, "timestamp_end", 101.2d, "output_tokens", 30, "input_tokens", 20,
                "concurrent_requests", 8),
            RequestRecord.of("request_id", "r3", "service_type", "vllm", "success", false, "latency_s", 2.0d,
                "timestamp_start", 101.0d, "timestamp_end", 103.0d, "error", "timeout",
                "concurrent_requests", 8),
            RequestRecord.of("request_id", "r4", "service_type", "vllm", "success", true, "latency_s", 1.5d,
                "timestamp_start", 101.5d, "timestamp_end", 104.0d, "output_tokens", 40, "input_tokens", 30,
                "concurrent_requests", 8));
    }

    private static RequestRecord kv(String operation, double latency, double start, int payload) {
        return RequestRecord.of("operation_type", operation, "service_type", "redis", "success", true,
            "latency_s", latency, "timestamp_start", start, "payload_size_bytes", payload);
    }
}

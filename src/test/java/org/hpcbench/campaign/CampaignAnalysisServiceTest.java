package org.hpcbench.campaign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.hpcbench.analysis.BottleneckCategory;
import org.hpcbench.analysis.BottleneckVerdict;
import org.hpcbench.analysis.RegressionComparator;
import org.hpcbench.analysis.RegressionVerdict;
import org.hpcbench.analysis.SaturationReport;
import org.hpcbench.analysis.Verdict;
import org.hpcbench.metrics.MetricsAggregator;
import org.hpcbench.metrics.Summary;
import org.hpcbench.obs.RecordingLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CampaignAnalysisServiceTest {
    @TempDir
    Path resultsDir;

    private ResultsLayout layout;
    private RecordingLogger logger;
    private CampaignAnalysisService service;

    @BeforeEach
    void setUp() {
        layout = new ResultsLayout(resultsDir);
        logger = new RecordingLogger();
        service = new CampaignAnalysisService(layout, new MetricsAggregator(), new RegressionComparator(), logger);
    }

    @Test
    void aggregateWritesSummaryNextToRecords() throws IOException {
        writeRecords("c4", 4, 0.2d, 10);

        Summary summary = service.aggregate("c4");

        assertTrue(Files.isRegularFile(layout.summaryFile("c4")));
        assertEquals(10L, summary.totalRequests());
        assertEquals(summary, service.loadSummary("c4").orElseThrow());
        assertEquals(4.0d, service.concurrencyOf("c4", summary), 1e-9);
    }

    @Test
    void campaignWithoutRecordsGetsEmptySummary() {
        Summary summary = service.aggregate("c0");

        assertTrue(summary.isEmpty());
        assertTrue(service.loadSummary("c0").orElseThrow().isEmpty());
    }

    @Test
    void compareWritesComparisonIntoCurrentCampaign() throws IOException {
        writeRecords("base", 4, 0.2d, 10);
        writeRecords("cur", 4, 0.3d, 10);
        service.aggregate("base");
        service.aggregate("cur");

        RegressionVerdict verdict = service.compare("base", "cur", Map.of()).orElseThrow();

        assertEquals(Verdict.FAIL, verdict.verdict());
        Document written = Document.parse(Files.readString(layout.comparisonFile("base", "cur")));
        assertEquals("FAIL", written.getString("verdict"));
        assertEquals("base", written.getString("baseline_id"));
        assertEquals("cur", written.getString("current_id"));
        assertTrue(logger.hasMessage("campaigns compared"));
    }

    @Test
    void compareWithoutSummaryIsSkipped() throws IOException {
        writeRecords("base", 4, 0.2d, 10);
        service.aggregate("base");

        assertTrue(service.compare("base", "missing", null).isEmpty());
        assertTrue(logger.hasMessage("comparison skipped: missing summary"));
    }

    @Test
    void saturationSweepsOverCollectedCampaigns() throws IOException {
        writeRecords("c1", 1, 0.10d, 10);
        writeRecords("c2", 2, 0.11d, 20);
        writeRecords("c4", 4, 0.15d, 36);
        for (String id : List.of("c1", "c2", "c4")) {
            service.aggregate(id);
        }

        SaturationReport report = service.analyzeSaturation(List.of("c4", "c1", "missing", "c2"), 0.5d);

        assertEquals(3, report.dataPoints());
        assertEquals(1.0d, report.xRange()[0], 1e-9);
        assertEquals(4.0d, report.xRange()[1], 1e-9);
        assertEquals("c1", report.points().get(0).label());
        assertTrue(report.sloLimit().orElseThrow().met());
        assertTrue(logger.hasMessage("campaign skipped in sweep: no summary"));
        assertThrows(IllegalArgumentException.class, () -> service.analyzeSaturation(List.of("missing"), null));
    }

    @Test
    void bottleneckUsesTelemetryWhenPresent() throws IOException {
        writeRecords("gpu", 8, 1.0d, 10);
        service.aggregate("gpu");
        Files.writeString(layout.telemetryFile("gpu"),
            "{\"gpu\": {\"gpu_utilization\": 97, \"memory_used_mb\": 1000, \"memory_total_mb\": 80000}}");

        BottleneckVerdict verdict = service.classifyBottleneck("gpu");

        assertEquals(BottleneckCategory.GPU_BOUND, verdict.classification());
        assertTrue(verdict.evidence().contains("High GPU utilization: 97%"));
    }

    @Test
    void bottleneckWithoutSummaryIsUnknown() {
        BottleneckVerdict verdict = service.classifyBottleneck("nothing");

        assertEquals(BottleneckCategory.UNKNOWN, verdict.classification());
        assertEquals(List.of("No summary available for campaign nothing"), verdict.evidence());
    }

    @Test
    void concurrencyFallsBackToClientCountThenOne() {
        Summary plain = Summary.builder().counts(1, 1, 0).successRate(100.0d).build();
        new RunMetadataStore(layout).write(new RunMetadata("three", Instant.EPOCH, "cluster-a", Map.of(), Map.of(),
            List.of(Map.of("name", "a"), Map.of("name", "b"), Map.of("name", "c"))));

        assertEquals(3.0d, service.concurrencyOf("three", plain), 1e-9);
        assertEquals(1.0d, service.concurrencyOf("none", plain), 1e-9);
    }

    private void writeRecords(String campaignId, int concurrency, double latency, int count) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double start = 1000.0d + i * 0.5d;
            lines.add("{\"benchmark_id\": \"" + campaignId + "\", \"request_id\": \"r" + i
                + "\", \"service_type\": \"generic\", \"success\": true, \"latency_s\": " + latency
                + ", \"timestamp_start\": " + start + ", \"timestamp_end\": " + (start + latency)
                + ", \"concurrent_requests\": " + concurrency + "}");
        }
        Files.createDirectories(layout.campaignDir(campaignId));
        Files.write(layout.requestsFile(campaignId), lines, StandardCharsets.UTF_8);
    }
}

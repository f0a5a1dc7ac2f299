package org.hpcbench.campaign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.hpcbench.analysis.RegressionComparator;
import org.hpcbench.config.BenchConfig;
import org.hpcbench.deploy.ClientDeployment;
import org.hpcbench.deploy.ClientSpec;
import org.hpcbench.deploy.DeploymentManager;
import org.hpcbench.deploy.JobScriptRenderer;
import org.hpcbench.deploy.JobState;
import org.hpcbench.deploy.ManualClock;
import org.hpcbench.deploy.ScriptContext;
import org.hpcbench.deploy.ServiceDeployment;
import org.hpcbench.deploy.ServiceSpec;
import org.hpcbench.metrics.MetricsAggregator;
import org.hpcbench.metrics.Summary;
import org.hpcbench.obs.RecordingLogger;
import org.hpcbench.remote.CommandResult;
import org.hpcbench.remote.FakeRemoteExecutor;
import org.hpcbench.store.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CampaignLifecycleTest {
    private static final String CAMPAIGN = "bench-1";
    private static final String WORKDIR = "/home/bench/benchmark_bench-1";

    @TempDir
    Path resultsDir;

    @TempDir
    Path stagingDir;

    private FakeRemoteExecutor executor;
    private InMemoryEntityStore store;
    private RecordingLogger logger;
    private ResultsLayout layout;
    private CollectionLock lock;
    private RunMetadataStore runMetadata;
    private CampaignAnalysisService analysis;
    private CampaignLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        executor = new FakeRemoteExecutor();
        store = new InMemoryEntityStore();
        logger = new RecordingLogger();
        ManualClock clock = new ManualClock(Instant.parse("2026-06-01T09:00:00Z"));
        DeploymentManager manager = DeploymentManager.builder(CAMPAIGN, executor, store, new PlainRenderer())
            .config(BenchConfig.builder().stagingDir(stagingDir).build())
            .logger(logger)
            .clock(clock)
            .sleeper(clock.sleeper())
            .build();
        layout = new ResultsLayout(resultsDir);
        lock = new CollectionLock(layout, clock);
        runMetadata = new RunMetadataStore(layout);
        analysis = new CampaignAnalysisService(layout, new MetricsAggregator(), new RegressionComparator(), logger);
        lifecycle = new CampaignLifecycle(
            manager,
            new ArtifactCollector(executor, layout, logger),
            lock,
            runMetadata,
            analysis,
            logger,
            clock);
    }

    @Test
    void recordRunDescribesDeployments() {
        seedService("1000");
        seedClient("load-1", "1001");

        RunMetadata run = lifecycle.recordRun("cluster-a", Map.of("service", "vllm"));

        assertEquals(CAMPAIGN, run.campaignId());
        assertEquals(Instant.parse("2026-06-01T09:00:00Z"), run.createdAt());
        assertEquals("vllm", run.service().get("name"));
        assertEquals("1000", run.service().get("job_id"));
        assertEquals(8000, run.service().get("port"));
        assertEquals("vllm", run.clients().get(0).get("service_name"));
        assertTrue(Files.exists(layout.runFile(CAMPAIGN)));
        assertEquals(run.recipeHash(), runMetadata.read(CAMPAIGN).orElseThrow().recipeHash());
    }

    @Test
    void fullCompletionStopsCollectsAndAggregates() {
        seedService("1000");
        seedClient("load-1", "1001");
        executor.jobStates("1000", "RUNNING")
            .jobStates("1001", "COMPLETED")
            .remoteFile(WORKDIR + "/load-1.hostname", "node-3\n")
            .respond("ls " + WORKDIR + "/metrics", CommandResult.ok(WORKDIR + "/metrics/load-1.jsonl\n"))
            .respond("ls " + WORKDIR + "/logs", CommandResult.ok(ArtifactCollector.NO_FILES + "\n"))
            .remoteFile(WORKDIR + "/metrics/load-1.jsonl", record("r1", 100.0d) + "\n" + record("r2", 101.0d) + "\n");
        lifecycle.recordRun("cluster-a", Map.of("service", "vllm"));

        CompletionResult result = lifecycle.handleCompletion(true, true, true);

        assertEquals(List.of(), result.errors());
        assertTrue(result.stopped());
        assertTrue(result.collected());
        assertTrue(result.aggregated());
        assertEquals(List.of("1000"), executor.cancelled());
        assertFalse(lock.isHeld(CAMPAIGN));
        assertEquals("node-3", runMetadata.read(CAMPAIGN).orElseThrow().clients().get(0).get("hostname"));

        Summary summary = analysis.loadSummary(CAMPAIGN).orElseThrow();
        assertEquals(2L, summary.totalRequests());
        assertTrue(logger.hasMessage("campaign completion handled"));
    }

    @Test
    void concurrentCollectionIsRejected() {
        CollectionLock.Held held = lock.tryAcquire(CAMPAIGN).orElseThrow();

        CompletionResult result = lifecycle.handleCompletion(false, true, true);

        assertEquals(List.of(CampaignLifecycle.COLLECTION_IN_PROGRESS), result.errors());
        assertFalse(result.collected());
        assertFalse(result.aggregated());
        assertTrue(executor.commands().stream().noneMatch(command -> command.startsWith("ls ")));
        assertTrue(lock.isHeld(CAMPAIGN));
        held.close();
    }

    @Test
    void refusedCancelIsReportedPerEntity() {
        seedService("1000");
        executor.jobStates("1000", "RUNNING").refuseCancel("1000");

        CompletionResult result = lifecycle.handleCompletion(true, false, false);

        assertFalse(result.stopped());
        assertEquals(List.of("Stop service vllm failed: cancel rejected"), result.errors());
        assertTrue(logger.hasMessage("campaign completion handled with errors"));
    }

    @Test
    void downloadFailuresDoNotBlockAggregation() {
        executor.respond("ls " + WORKDIR + "/metrics", CommandResult.ok(WORKDIR + "/metrics/lost.jsonl\n"))
            .respond("ls " + WORKDIR + "/logs", CommandResult.ok(ArtifactCollector.NO_FILES + "\n"));

        CompletionResult result = lifecycle.handleCompletion(false, true, true);

        assertEquals(List.of("Artifact download failed: " + WORKDIR + "/metrics/lost.jsonl"), result.errors());
        assertTrue(result.collected());
        assertTrue(result.aggregated());
        assertTrue(analysis.loadSummary(CAMPAIGN).orElseThrow().isEmpty());
    }

    @Test
    void completeWhenEveryClientIsTerminal() {
        seedService("1000");
        seedClient("load-1", "1001");
        seedClient("load-2", "1002");
        executor.jobStates("1000", "RUNNING")
            .jobStates("1001", "COMPLETED")
            .jobStates("1002", "RUNNING", "FAILED");

        CompletionStatus first = lifecycle.checkComplete();
        CompletionStatus second = lifecycle.checkComplete();

        assertFalse(first.complete());
        assertEquals(1, first.clientsDone());
        assertEquals(2, first.clientsTotal());
        assertEquals(JobState.RUNNING, first.serviceState());
        assertTrue(second.complete());
        assertEquals(2, second.clientsDone());
        assertTrue(second.errorMessage().isEmpty());
    }

    @Test
    void clientTotalFallsBackToRunMetadata() {
        runMetadata.write(new RunMetadata(CAMPAIGN, Instant.EPOCH, "cluster-a", Map.of(), Map.of(),
            List.of(Map.of("name", "load-1"), Map.of("name", "load-2"))));

        CompletionStatus status = lifecycle.checkComplete();

        assertFalse(status.complete());
        assertEquals(0, status.clientsDone());
        assertEquals(2, status.clientsTotal());
        assertEquals(JobState.UNKNOWN, status.serviceState());
    }

    private void seedService(String jobId) {
        store.save(CAMPAIGN, "service", "vllm",
            new ServiceDeployment("vllm", "vllm.sif", jobId, WORKDIR, 8000).toDocument());
    }

    private void seedClient(String name, String jobId) {
        store.save(CAMPAIGN, "client", name,
            new ClientDeployment(name, "vllm", "python bench.py", jobId, WORKDIR, null).toDocument());
    }

    private static String record(String requestId, double start) {
        return "{\"benchmark_id\": \"" + CAMPAIGN + "\", \"request_id\": \"" + requestId
            + "\", \"service_type\": \"vllm\", \"success\": true, \"latency_s\": 0.5, \"timestamp_start\": "
            + start + ", \"timestamp_end\": " + (start + 0.5d) + "}";
    }

    private static final class PlainRenderer implements JobScriptRenderer {
        @Override
        public String renderServiceScript(ServiceSpec spec, ScriptContext context) {
            return "#service " + spec.name();
        }

        @Override
        public String renderClientScript(ClientSpec spec, ScriptContext context) {
            return "#client " + spec.name();
        }
    }
}

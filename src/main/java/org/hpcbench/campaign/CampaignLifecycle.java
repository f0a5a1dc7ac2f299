package org.hpcbench.campaign;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.hpcbench.deploy.CampaignStatusSnapshot;
import org.hpcbench.deploy.ClientDeployment;
import org.hpcbench.deploy.DeploymentManager;
import org.hpcbench.deploy.EntityOutcome;
import org.hpcbench.deploy.EntityStatus;
import org.hpcbench.deploy.JobState;
import org.hpcbench.deploy.ServiceDeployment;
import org.hpcbench.deploy.StopCampaignResult;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;

/**
 * Post-run handling of one campaign: stop, collect and aggregate, in that order.
 */
public final class CampaignLifecycle {
    static final String COLLECTION_IN_PROGRESS = "Collection already in progress";

    private final DeploymentManager manager;
    private final ArtifactCollector collector;
    private final CollectionLock lock;
    private final RunMetadataStore runMetadata;
    private final CampaignAnalysisService analysis;
    private final JsonLinesLogger logger;
    private final Clock clock;

    public CampaignLifecycle(
        DeploymentManager manager,
        ArtifactCollector collector,
        CollectionLock lock,
        RunMetadataStore runMetadata,
        CampaignAnalysisService analysis,
        JsonLinesLogger logger,
        Clock clock
    ) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.runMetadata = Objects.requireNonNull(runMetadata, "runMetadata");
        this.analysis = Objects.requireNonNull(analysis, "analysis");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes {@code run.json} from the recipe and the deployments currently on record.
     */
    public RunMetadata recordRun(String target, Map<String, ?> recipe) {
        Map<String, Object> service = new LinkedHashMap<>();
        List<ServiceDeployment> services = manager.loadServices();
        if (!services.isEmpty()) {
            ServiceDeployment first = services.get(0);
            service.put("name", first.name());
            service.put("container_image", first.containerImage());
            service.put("job_id", first.jobId().orElse(null));
            service.put("hostname", first.host().orElse(null));
            service.put("port", first.port().orElse(null));
        }
        List<Map<String, Object>> clients = new ArrayList<>();
        for (ClientDeployment client : manager.loadClients()) {
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("name", client.name());
            descriptor.put("service_name", client.serviceName());
            descriptor.put("job_id", client.jobId().orElse(null));
            descriptor.put("hostname", client.host().orElse(null));
            clients.add(descriptor);
        }
        RunMetadata metadata = new RunMetadata(manager.campaignId(), clock.instant(), target, recipe, service, clients);
        runMetadata.write(metadata);
        logger.info("run metadata recorded", context("recordRun"), Map.of(
            "recipeHash", metadata.recipeHash(),
            "clients", clients.size()));
        return metadata;
    }

    /**
     * Runs the requested steps. A failing step is recorded in the result and later steps still
     * run, except that aggregation needs a successful collection.
     */
    public CompletionResult handleCompletion(boolean stop, boolean collect, boolean aggregate) {
        CorrelationContext ctx = context("handleCompletion");
        List<String> errors = new ArrayList<>();
        boolean stopped = false;
        boolean collected = false;
        boolean aggregated = false;

        if (stop) {
            try {
                StopCampaignResult result = manager.stopCampaign();
                for (EntityOutcome error : result.errors()) {
                    errors.add("Stop " + error.kind().storeKind() + " " + error.name() + " failed: " + error.detail());
                }
                stopped = !result.hasErrors();
            } catch (RuntimeException e) {
                errors.add("Stop failed: " + e.getMessage());
            }
        }

        if (collect) {
            Optional<CollectionLock.Held> held = lock.tryAcquire(manager.campaignId());
            if (held.isEmpty()) {
                errors.add(COLLECTION_IN_PROGRESS);
            } else {
                try (CollectionLock.Held ignored = held.get()) {
                    recordClientHosts(manager.campaignStatus());
                    CollectionReport report = collector.collect(manager.campaignId(), manager.workingDirectory());
                    for (String failure : report.failures()) {
                        errors.add("Artifact download failed: " + failure);
                    }
                    collected = true;
                } catch (RuntimeException e) {
                    errors.add("Collection error: " + e.getMessage());
                }
            }
        }

        if (aggregate && collected) {
            try {
                analysis.aggregate(manager.campaignId());
                aggregated = true;
            } catch (RuntimeException e) {
                errors.add("Aggregation failed: " + e.getMessage());
            }
        }

        CompletionResult result = new CompletionResult(stopped, collected, aggregated, errors);
        if (errors.isEmpty()) {
            logger.info("campaign completion handled", ctx, Map.of(
                "stopped", stopped, "collected", collected, "aggregated", aggregated));
        } else {
            logger.warn("campaign completion handled with errors", ctx, Map.of(
                "stopped", stopped, "collected", collected, "aggregated", aggregated, "errors", errors));
        }
        return result;
    }

    /**
     * Complete once at least one client exists and every client is terminal. While no client is
     * on record yet, the total falls back to the client count in run.json.
     */
    public CompletionStatus checkComplete() {
        CampaignStatusSnapshot snapshot;
        try {
            snapshot = manager.campaignStatus();
        } catch (RuntimeException e) {
            logger.error("completion check failed", context("checkComplete"), Map.of("error", String.valueOf(e.getMessage())));
            return CompletionStatus.failed(String.valueOf(e.getMessage()));
        }
        JobState serviceState = snapshot.services().isEmpty()
            ? JobState.UNKNOWN
            : snapshot.services().get(0).state();
        int clientsDone = (int) snapshot.clientsInTerminalState();
        int clientsTotal = snapshot.clients().size();
        boolean complete = clientsTotal > 0 && clientsDone == clientsTotal;
        if (clientsTotal == 0) {
            clientsTotal = runMetadata.read(manager.campaignId()).map(run -> run.clients().size()).orElse(0);
        }
        return new CompletionStatus(complete, serviceState, clientsDone, clientsTotal, null);
    }

    private void recordClientHosts(CampaignStatusSnapshot snapshot) {
        Map<String, String> hosts = new LinkedHashMap<>();
        for (EntityStatus client : snapshot.clients()) {
            if (client.host() != null) {
                hosts.put(client.name(), client.host());
            }
        }
        runMetadata.updateClientHosts(manager.campaignId(), hosts);
    }

    private CorrelationContext context(String operation) {
        return CorrelationContext.of(manager.campaignId(), operation);
    }
}

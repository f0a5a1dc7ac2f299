package org.hpcbench.deploy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.bson.Document;
import org.hpcbench.config.BenchConfig;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;
import org.hpcbench.remote.CommandResult;
import org.hpcbench.remote.ConnectivityException;
import org.hpcbench.remote.RemoteExecutor;
import org.hpcbench.store.EntityStore;

/**
 * Job-lifecycle state machine for the services and clients of one campaign.
 *
 * <p>All remote interaction goes through the injected {@link RemoteExecutor}; transient
 * {@link ConnectivityException}s are retried here with exponential backoff. Every call blocks the
 * invoking thread and instances are not thread-safe. A wait timeout never cancels the underlying
 * job: only {@link #cancel(String)} and {@link #stopCampaign()} change job state.
 *
 * <p>Status observations are monotonic per job handle: once a terminal state has been observed it
 * is returned for every later query without asking the scheduler again.
 */
public final class DeploymentManager {
    static final String NO_LOGS = "(no logs yet)";

    private final String campaignId;
    private final RemoteExecutor executor;
    private final EntityStore store;
    private final JobScriptRenderer renderer;
    private final BenchConfig config;
    private final JsonLinesLogger logger;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PollObserver pollObserver;
    private final ExponentialBackoff endpointBackoff;
    private final ExponentialBackoff connectivityBackoff;
    private final Map<String, JobState> observedStates = new HashMap<>();
    private String resolvedWorkingDirectory;
    private boolean workingDirectoryPrepared;

    private DeploymentManager(final Builder builder) {
        this.campaignId = Objects.requireNonNull(builder.campaignId, "campaignId");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.renderer = Objects.requireNonNull(builder.renderer, "renderer");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.logger = Objects.requireNonNull(builder.logger, "logger");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
        this.pollObserver = Objects.requireNonNull(builder.pollObserver, "pollObserver");
        this.endpointBackoff = ExponentialBackoff.doubling(config.endpointInitialDelay(), config.endpointMaxDelay());
        this.connectivityBackoff =
                ExponentialBackoff.doubling(config.connectivityInitialDelay(), config.connectivityMaxDelay());
    }

    public static Builder builder(
            final String campaignId,
            final RemoteExecutor executor,
            final EntityStore store,
            final JobScriptRenderer renderer) {
        return new Builder(campaignId, executor, store, renderer);
    }

    public String campaignId() {
        return campaignId;
    }

    /**
     * Remote working directory of the campaign. A leading {@code ~} is resolved once against the
     * remote {@code $HOME}; when that lookup fails the literal path is kept.
     */
    public String workingDirectory() {
        if (resolvedWorkingDirectory != null) {
            return resolvedWorkingDirectory;
        }
        String directory = config.workingDirectoryFor(campaignId);
        if (directory.startsWith("~")) {
            final CorrelationContext context = context("resolveWorkingDirectory", null, null);
            final Optional<String> home = remote("echo $HOME", context, () -> executor.execute("echo $HOME"))
                    .filter(CommandResult::succeeded)
                    .map(result -> result.stdout().trim())
                    .filter(value -> !value.isEmpty());
            if (home.isPresent()) {
                directory = home.get() + directory.substring(1);
            } else {
                logger.warn("could not resolve remote home directory; using literal path", context,
                        Map.of("workingDirectory", directory));
            }
        }
        resolvedWorkingDirectory = directory;
        return directory;
    }

    /**
     * Submits a service job and persists its record.
     *
     * <p>With {@code waitForStart} set, blocks until the job is RUNNING and its endpoint marker has
     * appeared. If either wait times out the job is left in place and the returned deployment
     * carries whatever state was last observed.
     *
     * @return the deployment, or empty when the job could not be submitted
     */
    public Optional<ServiceDeployment> deployService(final ServiceSpec spec) {
        Objects.requireNonNull(spec, "spec");
        final CorrelationContext context = context("deployService", spec.name(), null);
        if (!prepareWorkingDirectory(context)) {
            return Optional.empty();
        }
        final String script = renderer.renderServiceScript(spec, scriptContext(spec.name(), Optional.empty()));
        final Optional<String> submitted = stageAndSubmit(spec.name(), script, context);
        if (submitted.isEmpty()) {
            return Optional.empty();
        }
        final String jobId = submitted.get();
        final ServiceDeployment deployment = new ServiceDeployment(
                spec.name(), spec.containerImage(), jobId, workingDirectory(), spec.port().orElse(null));
        deployment.markSubmitted(clock.instant(), logPath(spec.name(), jobId));
        deployment.metadata().putAll(spec.metadata());
        observedStates.put(jobId, JobState.SUBMITTED);
        persist(EntityKind.SERVICE, spec.name(), deployment.toDocument(), context);

        if (spec.waitForStart()) {
            final CorrelationContext jobContext = context("deployService", spec.name(), jobId);
            if (waitForRunning(jobId, spec.runningTimeout().orElse(config.runningTimeout()))) {
                deployment.observe(JobState.RUNNING, clock.instant());
                persist(EntityKind.SERVICE, spec.name(), deployment.toDocument(), jobContext);
                final Optional<Endpoint> endpoint = waitForEndpoint(spec.name(), config.endpointTimeout());
                if (endpoint.isPresent()) {
                    deployment.resolveEndpoint(endpoint.get());
                    logger.info("service endpoint resolved", jobContext, Map.of("endpoint", endpoint.get().toString()));
                } else {
                    logger.warn("service endpoint did not appear; job left running", jobContext);
                }
            } else {
                status(jobId).ifPresent(state -> deployment.observe(state, clock.instant()));
                logger.warn("service did not reach RUNNING; job left in place", jobContext,
                        Map.of("state", deployment.state().name()));
            }
            persist(EntityKind.SERVICE, spec.name(), deployment.toDocument(), jobContext);
        }
        return Optional.of(deployment);
    }

    /**
     * Submits a client job against a running service.
     *
     * @return the deployment, or empty when the service is unknown, its endpoint never appears or
     *     the job could not be submitted
     * @throws IllegalStateException when the service exists but is not RUNNING; nothing is submitted
     */
    public Optional<ClientDeployment> deployClient(final ClientSpec spec, final String serviceName) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(serviceName, "serviceName");
        final CorrelationContext context = context("deployClient", spec.name(), null);
        final Optional<ServiceDeployment> loaded = loadService(serviceName);
        if (loaded.isEmpty()) {
            logger.error("client references unknown service", context, Map.of("service", serviceName));
            return Optional.empty();
        }
        final ServiceDeployment service = loaded.get();
        final String serviceJobId = service.jobId().orElseThrow(
                () -> new IllegalStateException("service '" + serviceName + "' has no job handle"));
        final JobState serviceState = status(serviceJobId).orElse(JobState.UNKNOWN);
        if (service.observe(serviceState, clock.instant())) {
            persist(EntityKind.SERVICE, serviceName, service.toDocument(), context);
        }
        if (serviceState != JobState.RUNNING) {
            throw new IllegalStateException("service '" + serviceName + "' is not running (state "
                    + serviceState + ", job " + serviceJobId + "); deploy it and wait for RUNNING before starting clients");
        }

        Endpoint endpoint = service.endpoint().orElse(null);
        if (endpoint == null) {
            endpoint = waitForEndpoint(serviceName, config.endpointTimeout()).orElse(null);
            if (endpoint == null) {
                logger.error("service endpoint unavailable; client not submitted", context,
                        Map.of("service", serviceName));
                return Optional.empty();
            }
            service.resolveEndpoint(endpoint);
            persist(EntityKind.SERVICE, serviceName, service.toDocument(), context);
        }

        if (!prepareWorkingDirectory(context)) {
            return Optional.empty();
        }
        final String script = renderer.renderClientScript(spec, scriptContext(spec.name(), Optional.of(endpoint)));
        final Optional<String> submitted = stageAndSubmit(spec.name(), script, context);
        if (submitted.isEmpty()) {
            return Optional.empty();
        }
        final String jobId = submitted.get();
        final ClientDeployment client = new ClientDeployment(
                spec.name(), serviceName, spec.benchmarkCommand(), jobId, workingDirectory(), endpoint);
        client.markSubmitted(clock.instant(), logPath(spec.name(), jobId), metricsPath(spec.name()));
        client.metadata().putAll(spec.metadata());
        observedStates.put(jobId, JobState.SUBMITTED);
        persist(EntityKind.CLIENT, spec.name(), client.toDocument(), context);

        if (spec.waitForStart()) {
            final CorrelationContext jobContext = context("deployClient", spec.name(), jobId);
            if (waitForRunning(jobId, spec.runningTimeout().orElse(config.runningTimeout()))) {
                client.observe(JobState.RUNNING, clock.instant());
                readMarker(spec.name(), jobContext).ifPresent(client::resolveHost);
            } else {
                status(jobId).ifPresent(state -> client.observe(state, clock.instant()));
                logger.warn("client did not reach RUNNING; job left in place", jobContext,
                        Map.of("state", client.state().name()));
            }
            persist(EntityKind.CLIENT, spec.name(), client.toDocument(), jobContext);
        }
        return Optional.of(client);
    }

    /**
     * Deploys {@code count} copies of a client named {@code <name>-1 .. <name>-count}, each without
     * its own running-wait. Failures are collected per client instead of aborting the batch.
     */
    public ClientBatchResult deployClients(final ClientSpec template, final String serviceName, final int count) {
        Objects.requireNonNull(template, "template");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        final List<ClientDeployment> deployed = new ArrayList<>();
        final List<EntityOutcome> failures = new ArrayList<>();
        for (int index = 1; index <= count; index++) {
            final String name = template.name() + "-" + index;
            try {
                final Optional<ClientDeployment> client = deployClient(template.renamed(name, false), serviceName);
                if (client.isPresent()) {
                    deployed.add(client.get());
                } else {
                    failures.add(new EntityOutcome(EntityKind.CLIENT, name, null, "deployment failed"));
                }
            } catch (IllegalStateException e) {
                failures.add(new EntityOutcome(EntityKind.CLIENT, name, null, e.getMessage()));
            }
        }
        logger.info("client batch deployed", context("deployClients", template.name(), null),
                Map.of("requested", count, "deployed", deployed.size(), "failed", failures.size()));
        return new ClientBatchResult(deployed, failures);
    }

    /**
     * Polls the job state every {@code polling.jobInterval} until RUNNING.
     *
     * @return true once RUNNING; false on a terminal state, on reaching the deadline or on interrupt
     */
    public boolean waitForRunning(final String jobId, final Duration maxWait) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(maxWait, "maxWait");
        final CorrelationContext context = context("waitForRunning", null, jobId);
        final Instant start = clock.instant();
        final Instant deadline = start.plus(maxWait);
        int attempt = 0;
        while (true) {
            attempt++;
            final JobState state = status(jobId).orElse(JobState.UNKNOWN);
            pollObserver.onPoll("running", jobId, attempt, Duration.between(start, clock.instant()), state.name());
            if (state == JobState.RUNNING) {
                logger.info("job running", context, Map.of("attempts", attempt));
                return true;
            }
            if (state.isTerminal()) {
                logger.warn("job ended before reaching RUNNING", context, Map.of("state", state.name()));
                return false;
            }
            if (!clock.instant().isBefore(deadline)) {
                logger.warn("timed out waiting for RUNNING", context,
                        Map.of("state", state.name(), "maxWaitSeconds", maxWait.getSeconds()));
                return false;
            }
            if (!pause(config.jobPollInterval())) {
                return false;
            }
        }
    }

    /**
     * Polls the endpoint marker the job writes once started, with doubling backoff between
     * attempts. The port comes from the stored service record, if any.
     */
    public Optional<Endpoint> waitForEndpoint(final String name, final Duration maxWait) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(maxWait, "maxWait");
        final CorrelationContext context = context("waitForEndpoint", name, null);
        final Instant start = clock.instant();
        final Instant deadline = start.plus(maxWait);
        int attempt = 0;
        while (true) {
            final Optional<String> host = readMarker(name, context);
            pollObserver.onPoll("endpoint", name, attempt + 1, Duration.between(start, clock.instant()),
                    host.orElse("pending"));
            if (host.isPresent()) {
                final Integer port = loadService(name).flatMap(ServiceDeployment::port).orElse(null);
                return Optional.of(new Endpoint(host.get(), port));
            }
            final Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                logger.warn("timed out waiting for endpoint marker", context,
                        Map.of("maxWaitSeconds", maxWait.getSeconds(), "attempts", attempt + 1));
                return Optional.empty();
            }
            final Duration delay = endpointBackoff.delayForAttempt(attempt++);
            final Duration remaining = Duration.between(now, deadline);
            if (!pause(delay.compareTo(remaining) < 0 ? delay : remaining)) {
                return Optional.empty();
            }
        }
    }

    /**
     * Current state of a job.
     *
     * @return empty when the scheduler does not know the handle or could not be reached
     */
    public Optional<JobState> status(final String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        final JobState last = observedStates.get(jobId);
        if (last != null && last.isTerminal()) {
            return Optional.of(last);
        }
        final Optional<String> raw = remote("jobStatus", context("status", null, jobId), () -> executor.jobStatus(jobId))
                .flatMap(Function.identity());
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        final JobState parsed = JobState.parse(raw.get());
        if (last == null) {
            if (parsed != JobState.UNKNOWN) {
                observedStates.put(jobId, parsed);
            }
            return Optional.of(parsed);
        }
        if (!last.canAdvanceTo(parsed)) {
            return Optional.of(last);
        }
        observedStates.put(jobId, parsed);
        return Optional.of(parsed);
    }

    /**
     * Requests cancellation of a job.
     *
     * @return false when the job is already known to be terminal or the scheduler refused
     */
    public boolean cancel(final String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        final CorrelationContext context = context("cancel", null, jobId);
        final JobState last = observedStates.get(jobId);
        if (last != null && last.isTerminal()) {
            logger.info("job already terminal; not cancelled", context, Map.of("state", last.name()));
            return false;
        }
        final boolean cancelled = remote("cancelJob", context, () -> executor.cancelJob(jobId)).orElse(false);
        if (cancelled) {
            logger.info("job cancelled", context);
        } else {
            logger.warn("job cancellation rejected", context);
        }
        return cancelled;
    }

    /**
     * Cancels every known service and client of the campaign independently.
     */
    public StopCampaignResult stopCampaign() {
        final List<EntityOutcome> stopped = new ArrayList<>();
        final List<EntityOutcome> skipped = new ArrayList<>();
        final List<EntityOutcome> errors = new ArrayList<>();
        for (ServiceDeployment service : loadServices()) {
            stopEntity(EntityKind.SERVICE, service.name(), service.jobId().orElse(null), stopped, skipped, errors);
        }
        for (ClientDeployment client : loadClients()) {
            stopEntity(EntityKind.CLIENT, client.name(), client.jobId().orElse(null), stopped, skipped, errors);
        }
        logger.info("campaign stop requested", context("stopCampaign", null, null),
                Map.of("stopped", stopped.size(), "skipped", skipped.size(), "errors", errors.size()));
        return new StopCampaignResult(stopped, skipped, errors);
    }

    /**
     * Queries every deployment and persists newly observed states, lifecycle timestamps and client
     * hosts. Jobs whose state cannot be observed are reported as {@link JobState#UNKNOWN}.
     */
    public CampaignStatusSnapshot campaignStatus() {
        final CorrelationContext context = context("campaignStatus", null, null);
        final List<EntityStatus> services = new ArrayList<>();
        for (ServiceDeployment service : loadServices()) {
            final Optional<JobState> observed = service.jobId().flatMap(this::status);
            final JobState state = observed.orElse(JobState.UNKNOWN);
            if (service.observe(state, clock.instant())) {
                persist(EntityKind.SERVICE, service.name(), service.toDocument(), context);
            }
            services.add(new EntityStatus(EntityKind.SERVICE, service.name(), service.jobId().orElse(null), state,
                    service.host().orElse(null), state != JobState.UNKNOWN));
        }
        final List<EntityStatus> clients = new ArrayList<>();
        for (ClientDeployment client : loadClients()) {
            final Optional<JobState> observed = client.jobId().flatMap(this::status);
            final JobState state = observed.orElse(JobState.UNKNOWN);
            boolean changed = client.observe(state, clock.instant());
            if ((state == JobState.RUNNING || state == JobState.COMPLETED) && client.host().isEmpty()) {
                final Optional<String> host = readMarker(client.name(), context);
                if (host.isPresent()) {
                    client.resolveHost(host.get());
                    changed = true;
                }
            }
            if (changed) {
                persist(EntityKind.CLIENT, client.name(), client.toDocument(), context);
            }
            clients.add(new EntityStatus(EntityKind.CLIENT, client.name(), client.jobId().orElse(null), state,
                    client.host().orElse(null), state != JobState.UNKNOWN));
        }
        return new CampaignStatusSnapshot(campaignId, clock.instant(), services, clients);
    }

    /**
     * Last {@code lines} lines of each deployment's job log, keyed by entity name.
     */
    public Map<String, String> tailLogs(final EntityKind kind, final int lines) {
        Objects.requireNonNull(kind, "kind");
        if (lines < 1) {
            throw new IllegalArgumentException("lines must be >= 1");
        }
        final CorrelationContext context = context("tailLogs", null, null);
        final Map<String, Optional<String>> logFiles = new LinkedHashMap<>();
        if (kind == EntityKind.SERVICE) {
            loadServices().forEach(service -> logFiles.put(service.name(), service.logFile()));
        } else {
            loadClients().forEach(client -> logFiles.put(client.name(), client.logFile()));
        }
        final Map<String, String> tails = new LinkedHashMap<>();
        for (Map.Entry<String, Optional<String>> entry : logFiles.entrySet()) {
            final String tail = entry.getValue()
                    .flatMap(path -> remote("tail", context, () -> executor.execute("tail -n " + lines + " " + path)))
                    .filter(CommandResult::succeeded)
                    .map(CommandResult::stdout)
                    .orElse(NO_LOGS);
            tails.put(entry.getKey(), tail);
        }
        return tails;
    }

    public Optional<ServiceDeployment> loadService(final String name) {
        return store.load(campaignId, EntityKind.SERVICE.storeKind(), name).map(ServiceDeployment::fromDocument);
    }

    public List<ServiceDeployment> loadServices() {
        return store.loadAll(campaignId, EntityKind.SERVICE.storeKind()).stream()
                .map(ServiceDeployment::fromDocument)
                .collect(Collectors.toList());
    }

    public Optional<ClientDeployment> loadClient(final String name) {
        return store.load(campaignId, EntityKind.CLIENT.storeKind(), name).map(ClientDeployment::fromDocument);
    }

    public List<ClientDeployment> loadClients() {
        return store.loadAll(campaignId, EntityKind.CLIENT.storeKind()).stream()
                .map(ClientDeployment::fromDocument)
                .collect(Collectors.toList());
    }

    private void stopEntity(
            final EntityKind kind,
            final String name,
            final String jobId,
            final List<EntityOutcome> stopped,
            final List<EntityOutcome> skipped,
            final List<EntityOutcome> errors) {
        if (jobId == null) {
            skipped.add(new EntityOutcome(kind, name, null, "no job handle"));
            return;
        }
        try {
            final JobState state = status(jobId).orElse(JobState.UNKNOWN);
            if (state.isTerminal()) {
                skipped.add(new EntityOutcome(kind, name, jobId, "already " + state.name()));
            } else if (cancel(jobId)) {
                stopped.add(new EntityOutcome(kind, name, jobId, "cancelled"));
            } else {
                errors.add(new EntityOutcome(kind, name, jobId, "cancel rejected"));
            }
        } catch (RuntimeException e) {
            logger.error("failed to stop job", context("stopCampaign", name, jobId),
                    Map.of("error", String.valueOf(e.getMessage())));
            errors.add(new EntityOutcome(kind, name, jobId, String.valueOf(e.getMessage())));
        }
    }

    private boolean prepareWorkingDirectory(final CorrelationContext context) {
        if (workingDirectoryPrepared) {
            return true;
        }
        final String directory = workingDirectory();
        final String command = "mkdir -p " + directory + "/logs " + directory + "/scripts " + directory + "/metrics";
        final Optional<CommandResult> result = remote("mkdir", context, () -> executor.execute(command));
        if (result.isEmpty() || !result.get().succeeded()) {
            logger.error("failed to create remote working directory", context, Map.of(
                    "workingDirectory", directory,
                    "stderr", result.map(CommandResult::stderr).orElse("")));
            return false;
        }
        workingDirectoryPrepared = true;
        return true;
    }

    private Optional<String> stageAndSubmit(final String name, final String script, final CorrelationContext context) {
        final Path localScript = config.stagingDir().resolve(campaignId + "_" + name + ".sh");
        final String remoteScript = workingDirectory() + "/scripts/" + name + ".sh";
        try {
            Files.createDirectories(config.stagingDir());
            Files.writeString(localScript, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("failed to stage job script", context,
                    Map.of("path", localScript.toString(), "error", String.valueOf(e.getMessage())));
            return Optional.empty();
        }
        final boolean uploaded = remote("upload", context, () -> executor.upload(localScript, remoteScript)).orElse(false);
        if (!uploaded) {
            logger.error("failed to upload job script", context, Map.of("remotePath", remoteScript));
            return Optional.empty();
        }
        final Optional<String> jobId = remote("submitJob", context, () -> executor.submitJob(remoteScript))
                .flatMap(Function.identity());
        if (jobId.isEmpty()) {
            logger.error("job submission rejected", context, Map.of("remotePath", remoteScript));
        } else {
            logger.info("job submitted", context("submit", name, jobId.get()), Map.of("remotePath", remoteScript));
        }
        return jobId;
    }

    private Optional<String> readMarker(final String name, final CorrelationContext context) {
        final String marker = markerPath(name);
        return remote("readMarker", context, () -> executor.execute("test -s " + marker + " && cat " + marker))
                .filter(CommandResult::succeeded)
                .map(result -> result.stdout().trim())
                .filter(value -> !value.isEmpty())
                .map(value -> value.lines().findFirst().orElse(value).trim());
    }

    private <T> Optional<T> remote(final String call, final CorrelationContext context, final Supplier<T> action) {
        final int maxAttempts = config.connectivityMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return Optional.ofNullable(action.get());
            } catch (ConnectivityException e) {
                if (attempt + 1 >= maxAttempts) {
                    logger.error("remote call failed after retries", context, Map.of(
                            "call", call,
                            "attempts", maxAttempts,
                            "error", String.valueOf(e.getMessage())));
                    return Optional.empty();
                }
                final Duration delay = connectivityBackoff.delayForAttempt(attempt);
                logger.warn("remote call failed; retrying", context, Map.of(
                        "call", call,
                        "attempt", attempt + 1,
                        "delayMillis", delay.toMillis(),
                        "error", String.valueOf(e.getMessage())));
                if (!pause(delay)) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private boolean pause(final Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("polling interrupted", context("poll", null, null));
            return false;
        }
    }

    private void persist(
            final EntityKind kind,
            final String name,
            final Document document,
            final CorrelationContext context) {
        if (!store.save(campaignId, kind.storeKind(), name, document)) {
            logger.warn("deployment state not persisted", context, Map.of("kind", kind.storeKind()));
        }
    }

    private ScriptContext scriptContext(final String name, final Optional<Endpoint> serviceEndpoint) {
        final String directory = workingDirectory();
        return new ScriptContext(
                campaignId,
                name,
                directory,
                directory + "/logs",
                directory + "/metrics",
                markerPath(name),
                serviceEndpoint);
    }

    private String markerPath(final String name) {
        return workingDirectory() + "/" + name + ".hostname";
    }

    private String logPath(final String name, final String jobId) {
        return workingDirectory() + "/logs/" + name + "_" + jobId + ".out";
    }

    private String metricsPath(final String name) {
        return workingDirectory() + "/metrics/" + name + ".jsonl";
    }

    private CorrelationContext context(final String operation, final String entity, final String jobId) {
        return CorrelationContext.builder(campaignId, operation).entity(entity).jobId(jobId).build();
    }

    public static final class Builder {
        private final String campaignId;
        private final RemoteExecutor executor;
        private final EntityStore store;
        private final JobScriptRenderer renderer;
        private BenchConfig config = BenchConfig.builder().build();
        private JsonLinesLogger logger = JsonLinesLogger.NOOP;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.system();
        private PollObserver pollObserver = PollObserver.NOOP;

        private Builder(
                final String campaignId,
                final RemoteExecutor executor,
                final EntityStore store,
                final JobScriptRenderer renderer) {
            this.campaignId = campaignId;
            this.executor = executor;
            this.store = store;
            this.renderer = renderer;
        }

        public Builder config(final BenchConfig config) {
            this.config = config;
            return this;
        }

        public Builder logger(final JsonLinesLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(final Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder pollObserver(final PollObserver pollObserver) {
            this.pollObserver = pollObserver;
            return this;
        }

        public DeploymentManager build() {
            return new DeploymentManager(this);
        }
    }
}

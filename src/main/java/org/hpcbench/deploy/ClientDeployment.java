package org.hpcbench.deploy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Persisted state of one load-generating client job.
 */
public final class ClientDeployment {
    private final String name;
    private final String serviceName;
    private final String benchmarkCommand;
    private final String jobId;
    private final String workingDirectory;
    private final Endpoint serviceEndpoint;
    private String host;
    private Instant submitTime;
    private Instant startTime;
    private Instant endTime;
    private String logFile;
    private String metricsFile;
    private JobState state;
    private final Map<String, Object> metadata;

    public ClientDeployment(
            final String name,
            final String serviceName,
            final String benchmarkCommand,
            final String jobId,
            final String workingDirectory,
            final Endpoint serviceEndpoint) {
        this.name = Objects.requireNonNull(name, "name");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.benchmarkCommand = benchmarkCommand;
        this.jobId = jobId;
        this.workingDirectory = workingDirectory;
        this.serviceEndpoint = serviceEndpoint;
        this.state = JobState.SUBMITTED;
        this.metadata = new LinkedHashMap<>();
    }

    public String name() {
        return name;
    }

    public String serviceName() {
        return serviceName;
    }

    public String benchmarkCommand() {
        return benchmarkCommand;
    }

    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    /**
     * Service endpoint the client was launched against.
     */
    public Optional<Endpoint> serviceEndpoint() {
        return Optional.ofNullable(serviceEndpoint);
    }

    /**
     * Node the client itself runs on, once known.
     */
    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    void resolveHost(final String host) {
        this.host = host;
    }

    public Optional<Instant> submitTime() {
        return Optional.ofNullable(submitTime);
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> endTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<String> logFile() {
        return Optional.ofNullable(logFile);
    }

    public Optional<String> metricsFile() {
        return Optional.ofNullable(metricsFile);
    }

    public JobState state() {
        return state;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    void markSubmitted(final Instant at, final String logFile, final String metricsFile) {
        this.submitTime = at;
        this.logFile = logFile;
        this.metricsFile = metricsFile;
        this.state = JobState.SUBMITTED;
    }

    boolean observe(final JobState observed, final Instant at) {
        if (observed == null || observed == JobState.UNKNOWN || !state.canAdvanceTo(observed)) {
            return false;
        }
        boolean changed = observed != state;
        state = observed;
        if ((observed == JobState.RUNNING || observed.isTerminal()) && startTime == null && observed != JobState.CANCELLED) {
            startTime = at;
            changed = true;
        }
        if (observed.isTerminal() && endTime == null) {
            endTime = at;
            changed = true;
        }
        return changed;
    }

    public Document toDocument() {
        Document document = new Document();
        document.put("name", name);
        document.put("service_name", serviceName);
        document.put("benchmark_command", benchmarkCommand);
        document.put("job_id", jobId);
        document.put("working_dir", workingDirectory);
        document.put("service_endpoint", serviceEndpoint == null ? null : serviceEndpoint.toDocument());
        document.put("host", host);
        document.put("submit_time", DeploymentDocuments.date(submitTime));
        document.put("start_time", DeploymentDocuments.date(startTime));
        document.put("end_time", DeploymentDocuments.date(endTime));
        document.put("log_file", logFile);
        document.put("metrics_file", metricsFile);
        document.put("state", state.name());
        document.put("metadata", new Document(metadata));
        return document;
    }

    public static ClientDeployment fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        ClientDeployment deployment = new ClientDeployment(
                DeploymentDocuments.text(document, "name"),
                DeploymentDocuments.text(document, "service_name"),
                DeploymentDocuments.text(document, "benchmark_command"),
                DeploymentDocuments.text(document, "job_id"),
                DeploymentDocuments.text(document, "working_dir"),
                Endpoint.fromDocument(document.get("service_endpoint")).orElse(null));
        deployment.host = DeploymentDocuments.text(document, "host");
        deployment.submitTime = DeploymentDocuments.instant(document, "submit_time");
        deployment.startTime = DeploymentDocuments.instant(document, "start_time");
        deployment.endTime = DeploymentDocuments.instant(document, "end_time");
        deployment.logFile = DeploymentDocuments.text(document, "log_file");
        deployment.metricsFile = DeploymentDocuments.text(document, "metrics_file");
        deployment.state = DeploymentDocuments.state(document);
        deployment.metadata.putAll(DeploymentDocuments.metadata(document));
        return deployment;
    }

    @Override
    public String toString() {
        return "ClientDeployment{name=" + name + ", service=" + serviceName + ", jobId=" + jobId + ", state=" + state + "}";
    }
}

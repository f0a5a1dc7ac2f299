package org.hpcbench.deploy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Persisted state of one deployed service job. Mutated in place as the endpoint and lifecycle
 * timestamps resolve.
 */
public final class ServiceDeployment {
    private final String name;
    private final String containerImage;
    private final String jobId;
    private final String workingDirectory;
    private final Integer port;
    private String host;
    private Instant submitTime;
    private Instant startTime;
    private Instant endTime;
    private String logFile;
    private JobState state;
    private final Map<String, Object> metadata;

    public ServiceDeployment(
            final String name,
            final String containerImage,
            final String jobId,
            final String workingDirectory,
            final Integer port) {
        this.name = Objects.requireNonNull(name, "name");
        this.containerImage = containerImage;
        this.jobId = jobId;
        this.workingDirectory = workingDirectory;
        this.port = port;
        this.state = JobState.SUBMITTED;
        this.metadata = new LinkedHashMap<>();
    }

    public String name() {
        return name;
    }

    public String containerImage() {
        return containerImage;
    }

    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    public Optional<Integer> port() {
        return Optional.ofNullable(port);
    }

    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    /**
     * Resolved endpoint; present once the job has published its host.
     */
    public Optional<Endpoint> endpoint() {
        return host == null ? Optional.empty() : Optional.of(new Endpoint(host, port));
    }

    public void resolveEndpoint(final Endpoint endpoint) {
        this.host = Objects.requireNonNull(endpoint, "endpoint").host();
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

    public JobState state() {
        return state;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    void markSubmitted(final Instant at, final String logFile) {
        this.submitTime = at;
        this.logFile = logFile;
        this.state = JobState.SUBMITTED;
    }

    /**
     * Records an observed state, filling the start/end timestamps the first time they are reached.
     *
     * @return whether anything changed
     */
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
        document.put("container_image", containerImage);
        document.put("job_id", jobId);
        document.put("working_dir", workingDirectory);
        document.put("port", port);
        document.put("host", host);
        document.put("url", endpoint().map(Endpoint::url).orElse(null));
        document.put("submit_time", DeploymentDocuments.date(submitTime));
        document.put("start_time", DeploymentDocuments.date(startTime));
        document.put("end_time", DeploymentDocuments.date(endTime));
        document.put("log_file", logFile);
        document.put("state", state.name());
        document.put("metadata", new Document(metadata));
        return document;
    }

    public static ServiceDeployment fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        ServiceDeployment deployment = new ServiceDeployment(
                DeploymentDocuments.text(document, "name"),
                DeploymentDocuments.text(document, "container_image"),
                DeploymentDocuments.text(document, "job_id"),
                DeploymentDocuments.text(document, "working_dir"),
                DeploymentDocuments.integer(document, "port"));
        deployment.host = DeploymentDocuments.text(document, "host");
        deployment.submitTime = DeploymentDocuments.instant(document, "submit_time");
        deployment.startTime = DeploymentDocuments.instant(document, "start_time");
        deployment.endTime = DeploymentDocuments.instant(document, "end_time");
        deployment.logFile = DeploymentDocuments.text(document, "log_file");
        deployment.state = DeploymentDocuments.state(document);
        deployment.metadata.putAll(DeploymentDocuments.metadata(document));
        return deployment;
    }

    @Override
    public String toString() {
        return "ServiceDeployment{name=" + name + ", jobId=" + jobId + ", state=" + state + ", host=" + host + "}";
    }
}

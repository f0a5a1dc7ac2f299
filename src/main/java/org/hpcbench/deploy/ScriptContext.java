package org.hpcbench.deploy;

import java.util.Objects;
import java.util.Optional;

/**
 * Remote paths and endpoint handed to a {@link JobScriptRenderer}.
 *
 * @param endpointMarkerPath file the job writes its hostname to once started
 * @param serviceEndpoint endpoint a client targets; absent for services
 */
public record ScriptContext(
        String campaignId,
        String entityName,
        String workingDirectory,
        String logDirectory,
        String metricsDirectory,
        String endpointMarkerPath,
        Optional<Endpoint> serviceEndpoint) {
    public ScriptContext {
        Objects.requireNonNull(campaignId, "campaignId");
        Objects.requireNonNull(entityName, "entityName");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(logDirectory, "logDirectory");
        Objects.requireNonNull(metricsDirectory, "metricsDirectory");
        Objects.requireNonNull(endpointMarkerPath, "endpointMarkerPath");
        serviceEndpoint = serviceEndpoint == null ? Optional.empty() : serviceEndpoint;
    }
}

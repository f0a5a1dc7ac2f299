package org.hpcbench.campaign;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes {@code run.json}.
 */
public final class RunMetadataStore {
    private final ResultsLayout layout;

    public RunMetadataStore(ResultsLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public Path write(RunMetadata metadata) {
        return JsonFiles.write(layout.runFile(metadata.campaignId()), metadata.toDocument());
    }

    public Optional<RunMetadata> read(String campaignId) {
        return JsonFiles.read(layout.runFile(campaignId)).map(RunMetadata::fromDocument);
    }

    /**
     * Records client hosts discovered after deployment. No-op when run.json is absent.
     */
    public Optional<RunMetadata> updateClientHosts(String campaignId, Map<String, String> hostsByClient) {
        Optional<RunMetadata> current = read(campaignId);
        if (current.isEmpty() || hostsByClient.isEmpty()) {
            return current;
        }
        RunMetadata updated = current.get().withClientHosts(hostsByClient);
        write(updated);
        return Optional.of(updated);
    }
}

package org.hpcbench.deploy;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of deploying several clients against one service.
 */
public record ClientBatchResult(List<ClientDeployment> deployed, List<EntityOutcome> failures) {
    public ClientBatchResult {
        deployed = List.copyOf(Objects.requireNonNull(deployed, "deployed"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public boolean allDeployed() {
        return failures.isEmpty();
    }
}

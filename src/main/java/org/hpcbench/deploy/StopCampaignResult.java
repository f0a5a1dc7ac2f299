package org.hpcbench.deploy;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of stopping every known job of a campaign. Entities already in a terminal state, or
 * without a job handle, are listed as skipped.
 */
public record StopCampaignResult(List<EntityOutcome> stopped, List<EntityOutcome> skipped, List<EntityOutcome> errors) {
    public StopCampaignResult {
        stopped = List.copyOf(Objects.requireNonNull(stopped, "stopped"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

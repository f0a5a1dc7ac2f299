package org.hpcbench.deploy;

import java.util.Objects;

/**
 * Observed state of one deployment. {@code observed} is false when the state is the
 * {@link JobState#UNKNOWN} sentinel because the scheduler could not be queried.
 */
public record EntityStatus(EntityKind kind, String name, String jobId, JobState state, String host, boolean observed) {
    public EntityStatus {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
    }
}

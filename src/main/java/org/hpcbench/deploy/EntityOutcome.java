package org.hpcbench.deploy;

import java.util.Objects;

/**
 * Per-entity result of an operation applied to a set of deployments.
 */
public record EntityOutcome(EntityKind kind, String name, String jobId, String detail) {
    public EntityOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        detail = detail == null ? "" : detail;
    }
}

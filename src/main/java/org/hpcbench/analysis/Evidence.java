package org.hpcbench.analysis;

import java.util.Objects;

/**
 * Score contribution of one triggered rule. An empty reason contributes weight without a
 * reported indicator.
 */
public record Evidence(BottleneckCategory category, int weight, String reason) {
    public Evidence {
        Objects.requireNonNull(category, "category");
        if (category == BottleneckCategory.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN does not accumulate evidence");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0");
        }
        reason = reason == null ? "" : reason;
    }
}

package org.hpcbench.analysis;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Recommended upper bound for the swept parameter.
 *
 * @param basis what the bound is derived from: {@code slo}, {@code saturation} or {@code none}
 */
public record SaturationRecommendation(Double maxRecommended, String basis, String summary, List<String> reasoning) {
    public SaturationRecommendation {
        Objects.requireNonNull(basis, "basis");
        Objects.requireNonNull(summary, "summary");
        reasoning = List.copyOf(Objects.requireNonNull(reasoning, "reasoning"));
    }

    public OptionalDouble maxRecommendedValue() {
        return maxRecommended == null ? OptionalDouble.empty() : OptionalDouble.of(maxRecommended);
    }
}

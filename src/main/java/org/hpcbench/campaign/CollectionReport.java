package org.hpcbench.campaign;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one artifact collection pass.
 *
 * @param metricFiles request streams downloaded from the cluster
 * @param mergedLines lines written to {@code requests.jsonl}
 * @param foreignLines lines dropped because they carried another campaign's id
 * @param logFiles local names of downloaded job logs
 * @param failures remote paths or steps that could not be completed
 */
public record CollectionReport(
    List<String> metricFiles,
    int mergedLines,
    int foreignLines,
    List<String> logFiles,
    List<String> failures
) {
    public CollectionReport {
        metricFiles = List.copyOf(Objects.requireNonNull(metricFiles, "metricFiles"));
        logFiles = List.copyOf(Objects.requireNonNull(logFiles, "logFiles"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

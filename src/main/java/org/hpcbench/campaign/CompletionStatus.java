package org.hpcbench.campaign;

import java.util.Objects;
import java.util.Optional;
import org.hpcbench.deploy.JobState;

/**
 * Whether every client of a campaign reached a terminal state.
 *
 * @param error set when the scheduler could not be queried; the other fields are then zero values
 */
public record CompletionStatus(boolean complete, JobState serviceState, int clientsDone, int clientsTotal, String error) {
    public CompletionStatus {
        Objects.requireNonNull(serviceState, "serviceState");
    }

    static CompletionStatus failed(String error) {
        return new CompletionStatus(false, JobState.UNKNOWN, 0, 0, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}

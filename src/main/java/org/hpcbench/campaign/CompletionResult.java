package org.hpcbench.campaign;

import java.util.List;
import java.util.Objects;

/**
 * Steps of post-campaign handling that succeeded, plus the errors of those that did not.
 */
public record CompletionResult(boolean stopped, boolean collected, boolean aggregated, List<String> errors) {
    public CompletionResult {
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }
}

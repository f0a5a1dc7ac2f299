package org.hpcbench.deploy;

import java.time.Duration;

/**
 * Receives one callback per polling attempt, for progress display.
 */
@FunctionalInterface
public interface PollObserver {
    PollObserver NOOP = (phase, subject, attempt, elapsed, observation) -> { };

    void onPoll(String phase, String subject, int attempt, Duration elapsed, String observation);
}

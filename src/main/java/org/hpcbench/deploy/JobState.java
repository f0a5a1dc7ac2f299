package org.hpcbench.deploy;

import java.util.Locale;

/**
 * Scheduler job lifecycle: {@code SUBMITTED -> PENDING -> RUNNING -> terminal}.
 *
 * <p>Terminal states are absorbing. {@link #UNKNOWN} is a sentinel for states that could not be
 * observed and never takes part in transitions.
 */
public enum JobState {
    SUBMITTED(0),
    PENDING(1),
    RUNNING(2),
    COMPLETED(3),
    FAILED(3),
    CANCELLED(3),
    TIMEOUT(3),
    UNKNOWN(-1);

    private final int rank;

    JobState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 3;
    }

    /**
     * Whether moving from this state to {@code next} is a forward step in the lifecycle.
     */
    public boolean canAdvanceTo(JobState next) {
        if (next == UNKNOWN || isTerminal()) {
            return false;
        }
        return this == UNKNOWN || next.rank >= rank;
    }

    /**
     * Maps a raw scheduler state string ({@code "CANCELLED by 1234"}, {@code "COMPLETING"},
     * {@code "NODE_FAIL"}) onto the lifecycle.
     */
    public static JobState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String token = raw.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
        if (token.endsWith("+")) {
            token = token.substring(0, token.length() - 1);
        }
        return switch (token) {
            case "SUBMITTED" -> SUBMITTED;
            case "PENDING", "CONFIGURING", "REQUEUED", "RESIZING", "SUSPENDED" -> PENDING;
            case "RUNNING", "COMPLETING", "STAGE_OUT", "SIGNALING" -> RUNNING;
            case "COMPLETED" -> COMPLETED;
            case "FAILED", "NODE_FAIL", "BOOT_FAIL", "OUT_OF_MEMORY", "DEADLINE", "PREEMPTED" -> FAILED;
            case "CANCELLED" -> CANCELLED;
            case "TIMEOUT" -> TIMEOUT;
            default -> UNKNOWN;
        };
    }
}

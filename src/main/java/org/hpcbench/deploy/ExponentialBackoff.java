package org.hpcbench.deploy;

import java.time.Duration;
import java.util.Objects;

/**
 * Pure backoff policy: attempt index to delay, growing geometrically up to a cap.
 */
public final class ExponentialBackoff {
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay) {
        this.initialDelay = requirePositive(initialDelay, "initialDelay");
        this.maxDelay = requirePositive(maxDelay, "maxDelay");
        if (!Double.isFinite(multiplier) || multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be finite and >= 1.0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.multiplier = multiplier;
    }

    /**
     * Doubling backoff, the policy used for endpoint and connectivity polling.
     */
    public static ExponentialBackoff doubling(Duration initialDelay, Duration maxDelay) {
        return new ExponentialBackoff(initialDelay, 2.0d, maxDelay);
    }

    /**
     * Delay to wait after the given zero-based attempt.
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        double scaled = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        if (!Double.isFinite(scaled) || scaled >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(scaled));
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    private static Duration requirePositive(Duration value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(fieldName + " must be positive");
        }
        return value;
    }
}

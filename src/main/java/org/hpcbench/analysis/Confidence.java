package org.hpcbench.analysis;

import java.util.Locale;

/**
 * Confidence of a bottleneck classification, from the gap between the two best scores.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    static Confidence fromScores(int best, int secondBest) {
        if (best == 0) {
            return LOW;
        }
        int gap = best - secondBest;
        if (gap >= 2) {
            return HIGH;
        }
        if (gap >= 1) {
            return MEDIUM;
        }
        return LOW;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

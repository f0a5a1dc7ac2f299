package org.hpcbench.analysis;

/**
 * Largest swept value whose p99 latency stays within an SLO threshold.
 *
 * <p>When no point qualifies the limit is reported as not met rather than omitted; its
 * {@link #maxX()}, {@link #p99Latency()} and {@link #index()} are then meaningless.
 */
public record SloLimit(
    double threshold,
    boolean met,
    double maxX,
    double p99Latency,
    double headroomPercent,
    int index
) {
    static SloLimit met(double threshold, double maxX, double p99Latency, int index) {
        double headroom = (threshold - p99Latency) / threshold * 100.0d;
        return new SloLimit(threshold, true, maxX, p99Latency, headroom, index);
    }

    static SloLimit notMet(double threshold) {
        return new SloLimit(threshold, false, Double.NaN, Double.NaN, Double.NaN, -1);
    }

    public String unmetMessage() {
        return "No concurrency level meets SLO threshold of " + threshold + "s";
    }
}

package org.hpcbench.analysis;

/**
 * Sweep point where p99 latency starts growing sharply.
 */
public record LatencyKnee(double x, double p99Latency, int index) {
}

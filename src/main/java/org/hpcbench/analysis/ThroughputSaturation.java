package org.hpcbench.analysis;

/**
 * Sweep point where throughput stops scaling with the swept parameter.
 */
public record ThroughputSaturation(double x, double throughput, double efficiency, int index) {
}

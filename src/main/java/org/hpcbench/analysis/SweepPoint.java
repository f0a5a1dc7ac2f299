package org.hpcbench.analysis;

import java.util.Objects;
import org.hpcbench.metrics.Summary;

/**
 * One campaign of a sweep: the swept parameter value and the measurements it produced.
 */
public record SweepPoint(String label, double x, double throughput, double p95Latency, double p99Latency) {
    public SweepPoint {
        Objects.requireNonNull(label, "label");
        requireFinite(x, "x");
        requireFinite(throughput, "throughput");
        requireFinite(p95Latency, "p95Latency");
        requireFinite(p99Latency, "p99Latency");
    }

    public static SweepPoint fromSummary(String label, double x, Summary summary) {
        Objects.requireNonNull(summary, "summary");
        return new SweepPoint(
            label,
            x,
            summary.requestsPerSecond(),
            summary.latency().p95(),
            summary.latency().p99()
        );
    }

    /**
     * Throughput per unit of the swept parameter, 0 when x is not positive.
     */
    public double efficiency() {
        return x > 0.0d ? throughput / x : 0.0d;
    }

    private static void requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite");
        }
    }
}

package org.hpcbench.metrics;

import java.util.Collection;
import java.util.Map;
import org.bson.Document;

/**
 * Latency statistics in seconds. Percentiles satisfy {@code p50 <= p90 <= p95 <= p99 <= max}.
 */
public record LatencyDistribution(
        double avg,
        double min,
        double max,
        double std,
        double p50,
        double p90,
        double p95,
        double p99) {
    public static final LatencyDistribution ZERO = new LatencyDistribution(0, 0, 0, 0, 0, 0, 0, 0);

    public static LatencyDistribution of(final Collection<Double> latencies) {
        if (latencies.isEmpty()) {
            return ZERO;
        }
        final double[] sorted = Percentiles.sortedCopy(latencies);
        return new LatencyDistribution(
                Percentiles.mean(sorted),
                sorted[0],
                sorted[sorted.length - 1],
                Percentiles.sampleStandardDeviation(sorted),
                Percentiles.interpolated(sorted, 50),
                Percentiles.interpolated(sorted, 90),
                Percentiles.interpolated(sorted, 95),
                Percentiles.interpolated(sorted, 99));
    }

    /**
     * p99 over p50; 0 when the median is 0.
     */
    public double tailSpread() {
        return p50 > 0.0d ? p99 / p50 : 0.0d;
    }

    public Document toDocument() {
        return new Document("avg", avg)
                .append("min", min)
                .append("max", max)
                .append("std", std)
                .append("p50", p50)
                .append("p90", p90)
                .append("p95", p95)
                .append("p99", p99);
    }

    static LatencyDistribution fromDocument(final Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return ZERO;
        }
        return new LatencyDistribution(
                number(map, "avg"),
                number(map, "min"),
                number(map, "max"),
                number(map, "std"),
                number(map, "p50"),
                number(map, "p90"),
                number(map, "p95"),
                number(map, "p99"));
    }

    private static double number(final Map<?, ?> map, final String key) {
        final Object value = map.get(key);
        return value instanceof Number number ? number.doubleValue() : 0.0d;
    }
}

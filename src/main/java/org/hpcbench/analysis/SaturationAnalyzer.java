package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.hpcbench.config.ConfigurationException;

/**
 * Finds the latency knee, the throughput saturation point and the SLO-bounded operating point of
 * a parameter sweep.
 */
public final class SaturationAnalyzer {
    public static final String DEFAULT_PARAMETER = "concurrency";

    private final String parameter;

    public SaturationAnalyzer() {
        this(DEFAULT_PARAMETER);
    }

    public SaturationAnalyzer(String parameter) {
        if (parameter == null || parameter.trim().isEmpty()) {
            throw new IllegalArgumentException("parameter must not be blank");
        }
        this.parameter = parameter.trim();
    }

    public SaturationReport analyze(List<SweepPoint> points) {
        return analyze(points, null);
    }

    /**
     * @param sloThreshold p99 ceiling in seconds, or null for no SLO
     * @throws ConfigurationException when the threshold is not a positive finite number
     */
    public SaturationReport analyze(List<SweepPoint> points, Double sloThreshold) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("at least one sweep point is required");
        }
        if (sloThreshold != null) {
            requireThreshold(sloThreshold);
        }
        List<SweepPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(SweepPoint::x)
            .thenComparingDouble(SweepPoint::throughput)
            .thenComparingDouble(SweepPoint::p99Latency));
        double[] x = new double[sorted.size()];
        double[] throughput = new double[sorted.size()];
        double[] p99 = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            x[i] = sorted.get(i).x();
            throughput[i] = sorted.get(i).throughput();
            p99[i] = sorted.get(i).p99Latency();
        }

        LatencyKnee latencyKnee = findLatencyKnee(x, p99).orElse(null);
        ThroughputSaturation saturation = findThroughputSaturation(x, throughput).orElse(null);
        SloLimit sloLimit = sloThreshold == null ? null : findSloLimit(x, p99, sloThreshold);
        SaturationRecommendation recommendation = recommend(latencyKnee, saturation, sloLimit);
        return new SaturationReport(parameter, sorted, latencyKnee, saturation, sloLimit, recommendation);
    }

    public static Optional<LatencyKnee> findLatencyKnee(double[] x, double[] p99Latencies) {
        OptionalInt knee = KneeDetector.findKnee(x, p99Latencies);
        if (knee.isEmpty()) {
            return Optional.empty();
        }
        int index = knee.getAsInt();
        return Optional.of(new LatencyKnee(x[index], p99Latencies[index], index));
    }

    public static Optional<ThroughputSaturation> findThroughputSaturation(double[] x, double[] throughputs) {
        OptionalInt knee = KneeDetector.findKnee(x, throughputs);
        if (knee.isEmpty()) {
            return Optional.empty();
        }
        int index = knee.getAsInt();
        double efficiency = x[index] > 0.0d ? throughputs[index] / x[index] : 0.0d;
        return Optional.of(new ThroughputSaturation(x[index], throughputs[index], efficiency, index));
    }

    /**
     * Largest x whose p99 latency is within the threshold; x is expected in ascending order.
     */
    public static SloLimit findSloLimit(double[] x, double[] p99Latencies, double threshold) {
        requireThreshold(threshold);
        if (x.length != p99Latencies.length) {
            throw new IllegalArgumentException("x and p99Latencies must have the same length");
        }
        for (int i = x.length - 1; i >= 0; i--) {
            if (p99Latencies[i] <= threshold) {
                return SloLimit.met(threshold, x[i], p99Latencies[i], i);
            }
        }
        return SloLimit.notMet(threshold);
    }

    private SaturationRecommendation recommend(
        LatencyKnee latencyKnee,
        ThroughputSaturation saturation,
        SloLimit sloLimit
    ) {
        List<String> reasoning = new ArrayList<>();
        if (sloLimit != null && sloLimit.met()) {
            reasoning.add("SLO limit: " + parameter + " " + formatX(sloLimit.maxX())
                + " (P99=" + millis(sloLimit.p99Latency()) + "ms, headroom="
                + oneDecimal(sloLimit.headroomPercent()) + "%)");
        }
        if (latencyKnee != null) {
            reasoning.add("Latency knee: " + parameter + " " + formatX(latencyKnee.x())
                + " (P99=" + millis(latencyKnee.p99Latency()) + "ms)");
        }
        if (saturation != null) {
            reasoning.add("Throughput saturation: " + parameter + " " + formatX(saturation.x())
                + " (" + oneDecimal(saturation.throughput()) + " RPS)");
        }

        if (sloLimit != null && sloLimit.met()) {
            return new SaturationRecommendation(
                sloLimit.maxX(),
                "slo",
                "Recommended max " + parameter + ": " + formatX(sloLimit.maxX()) + " (based on SLO compliance)",
                reasoning
            );
        }
        Double candidate = null;
        if (latencyKnee != null) {
            candidate = latencyKnee.x();
        }
        if (saturation != null) {
            candidate = candidate == null ? saturation.x() : Math.min(candidate, saturation.x());
        }
        if (candidate == null) {
            return new SaturationRecommendation(
                null,
                "none",
                "Insufficient data for recommendation. Run more " + parameter + " levels.",
                reasoning
            );
        }
        return new SaturationRecommendation(
            candidate,
            "saturation",
            "Recommended max " + parameter + ": " + formatX(candidate) + " (based on saturation analysis)",
            reasoning
        );
    }

    static String formatX(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String millis(double seconds) {
        return oneDecimal(seconds * 1000.0d);
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static void requireThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold <= 0.0d) {
            throw new ConfigurationException("SLO threshold must be a positive number of seconds: " + threshold);
        }
    }
}

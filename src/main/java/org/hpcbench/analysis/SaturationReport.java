package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Saturation analysis of one sweep, points ordered by the swept parameter.
 */
public final class SaturationReport {
    private final String parameter;
    private final List<SweepPoint> points;
    private final LatencyKnee latencyKnee;
    private final ThroughputSaturation throughputSaturation;
    private final SloLimit sloLimit;
    private final SaturationRecommendation recommendation;

    SaturationReport(
        String parameter,
        List<SweepPoint> points,
        LatencyKnee latencyKnee,
        ThroughputSaturation throughputSaturation,
        SloLimit sloLimit,
        SaturationRecommendation recommendation
    ) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.points = List.copyOf(Objects.requireNonNull(points, "points"));
        if (this.points.isEmpty()) {
            throw new IllegalArgumentException("points must not be empty");
        }
        this.latencyKnee = latencyKnee;
        this.throughputSaturation = throughputSaturation;
        this.sloLimit = sloLimit;
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation");
    }

    public String parameter() {
        return parameter;
    }

    public List<SweepPoint> points() {
        return points;
    }

    public int dataPoints() {
        return points.size();
    }

    public double[] xRange() {
        return range(points.stream().mapToDouble(SweepPoint::x).toArray());
    }

    public double[] throughputRange() {
        return range(points.stream().mapToDouble(SweepPoint::throughput).toArray());
    }

    public double[] p99LatencyRange() {
        return range(points.stream().mapToDouble(SweepPoint::p99Latency).toArray());
    }

    public Optional<LatencyKnee> latencyKnee() {
        return Optional.ofNullable(latencyKnee);
    }

    public Optional<ThroughputSaturation> throughputSaturation() {
        return Optional.ofNullable(throughputSaturation);
    }

    /**
     * Present whenever an SLO threshold was supplied, met or not.
     */
    public Optional<SloLimit> sloLimit() {
        return Optional.ofNullable(sloLimit);
    }

    public SaturationRecommendation recommendation() {
        return recommendation;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("parameter", parameter);
        root.put("data_points", points.size());
        root.put("concurrency_range", asList(xRange()));
        root.put("throughput_range", asList(throughputRange()));
        root.put("p99_latency_range", asList(p99LatencyRange()));
        if (latencyKnee != null) {
            Map<String, Object> knee = new LinkedHashMap<>();
            knee.put("concurrency", latencyKnee.x());
            knee.put("p99_latency", latencyKnee.p99Latency());
            knee.put("index", latencyKnee.index());
            knee.put("type", "latency_knee");
            root.put("latency_knee", knee);
        }
        if (throughputSaturation != null) {
            Map<String, Object> saturation = new LinkedHashMap<>();
            saturation.put("concurrency", throughputSaturation.x());
            saturation.put("throughput", throughputSaturation.throughput());
            saturation.put("efficiency", throughputSaturation.efficiency());
            saturation.put("index", throughputSaturation.index());
            saturation.put("type", "throughput_saturation");
            root.put("throughput_saturation", saturation);
        }
        if (sloLimit != null) {
            Map<String, Object> slo = new LinkedHashMap<>();
            if (sloLimit.met()) {
                slo.put("max_concurrency", sloLimit.maxX());
                slo.put("p99_latency", sloLimit.p99Latency());
                slo.put("slo_threshold", sloLimit.threshold());
                slo.put("headroom_percent", sloLimit.headroomPercent());
                slo.put("index", sloLimit.index());
                slo.put("type", "slo_limit");
            } else {
                slo.put("slo_threshold", sloLimit.threshold());
                slo.put("error", sloLimit.unmetMessage());
            }
            root.put("slo_limit", slo);
        }
        Map<String, Object> rec = new LinkedHashMap<>();
        rec.put("summary", recommendation.summary());
        rec.put("max_recommended_concurrency", recommendation.maxRecommended());
        rec.put("basis", recommendation.basis());
        rec.put("reasoning", recommendation.reasoning());
        root.put("recommendation", rec);
        return root;
    }

    private static double[] range(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new double[] {min, max};
    }

    private static List<Double> asList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }
}

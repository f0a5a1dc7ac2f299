package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.hpcbench.metrics.Summary;

/**
 * Compares a current campaign against a baseline.
 */
public final class RegressionComparator {
    private final RegressionThresholds defaults;

    public RegressionComparator() {
        this(RegressionThresholds.defaults());
    }

    /**
     * @param defaults thresholds that per-call overrides are merged over
     */
    public RegressionComparator(RegressionThresholds defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public RegressionVerdict compare(Summary baseline, Summary current) {
        return compare(baseline, current, defaults);
    }

    public RegressionVerdict compare(Summary baseline, Summary current, Map<String, ?> overrides) {
        return compare(baseline, current, defaults.merge(overrides));
    }

    public RegressionVerdict compare(Summary baseline, Summary current, RegressionThresholds thresholds) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(thresholds, "thresholds");
        List<MetricComparison> comparisons = new ArrayList<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            comparisons.add(compareMetric(
                metric,
                baseline.valueAt(metric.path()).orElse(0.0d),
                current.valueAt(metric.path()).orElse(0.0d),
                metric.thresholdFrom(thresholds)
            ));
        }
        return new RegressionVerdict(baseline.serviceType(), current.serviceType(), thresholds, comparisons);
    }

    static MetricComparison compareMetric(TrackedMetric metric, double baseline, double current, double threshold) {
        double delta = current - baseline;
        double percentChange = baseline != 0.0d ? delta / baseline * 100.0d : 0.0d;
        boolean regression = metric.direction().regressed(percentChange, threshold);
        boolean improvement = !regression && metric.direction().improved(percentChange, threshold);
        return new MetricComparison(metric, baseline, current, delta, percentChange, regression, improvement, threshold);
    }
}

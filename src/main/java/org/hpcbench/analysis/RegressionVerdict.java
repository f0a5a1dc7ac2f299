package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-metric comparison of two campaigns and the overall verdict. FAIL iff any tracked metric
 * regressed.
 */
public final class RegressionVerdict {
    private final String baselineLabel;
    private final String currentLabel;
    private final RegressionThresholds thresholds;
    private final List<MetricComparison> comparisons;

    RegressionVerdict(
        String baselineLabel,
        String currentLabel,
        RegressionThresholds thresholds,
        List<MetricComparison> comparisons
    ) {
        this.baselineLabel = Objects.requireNonNull(baselineLabel, "baselineLabel");
        this.currentLabel = Objects.requireNonNull(currentLabel, "currentLabel");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.comparisons = List.copyOf(Objects.requireNonNull(comparisons, "comparisons"));
    }

    public String baselineLabel() {
        return baselineLabel;
    }

    public String currentLabel() {
        return currentLabel;
    }

    public RegressionThresholds thresholds() {
        return thresholds;
    }

    public List<MetricComparison> comparisons() {
        return comparisons;
    }

    public MetricComparison comparisonFor(TrackedMetric metric) {
        for (MetricComparison comparison : comparisons) {
            if (comparison.metric() == metric) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("metric not compared: " + metric);
    }

    public List<MetricComparison> regressions() {
        return comparisons.stream().filter(MetricComparison::regression).toList();
    }

    public List<MetricComparison> improvements() {
        return comparisons.stream().filter(MetricComparison::improvement).toList();
    }

    public Verdict verdict() {
        return regressions().isEmpty() ? Verdict.PASS : Verdict.FAIL;
    }

    /**
     * Comparison record as persisted next to the campaign results.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("baseline", baselineLabel);
        root.put("current", currentLabel);
        root.put("thresholds", thresholds.toMap());
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (MetricComparison comparison : comparisons) {
            metrics.put(comparison.metric().path(), comparison.toMap());
        }
        root.put("metrics", metrics);
        List<Map<String, Object>> regressionList = new ArrayList<>();
        for (MetricComparison comparison : regressions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("metric", comparison.metric().label());
            entry.put("change", comparison.formattedChange());
            entry.put("threshold", comparison.threshold() + "%");
            regressionList.add(entry);
        }
        root.put("regressions", regressionList);
        List<Map<String, Object>> improvementList = new ArrayList<>();
        for (MetricComparison comparison : improvements()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("metric", comparison.metric().label());
            entry.put("change", comparison.formattedChange());
            improvementList.add(entry);
        }
        root.put("improvements", improvementList);
        root.put("verdict", verdict().name());
        return root;
    }
}

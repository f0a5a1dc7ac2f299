package org.hpcbench.analysis;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Baseline-versus-current delta of one tracked metric.
 */
public record MetricComparison(
    TrackedMetric metric,
    double baseline,
    double current,
    double delta,
    double percentChange,
    boolean regression,
    boolean improvement,
    double threshold
) {
    public MetricComparison {
        Objects.requireNonNull(metric, "metric");
        if (regression && improvement) {
            throw new IllegalArgumentException("a metric cannot both regress and improve");
        }
    }

    /**
     * Signed percent change with one decimal, e.g. {@code -15.0%}.
     */
    public String formattedChange() {
        return String.format(Locale.ROOT, "%+.1f%%", percentChange);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("label", metric.label());
        map.put("baseline", baseline);
        map.put("current", current);
        map.put("delta", delta);
        map.put("percent_change", percentChange);
        map.put("regression", regression);
        map.put("improvement", improvement);
        map.put("threshold", threshold);
        return map;
    }
}

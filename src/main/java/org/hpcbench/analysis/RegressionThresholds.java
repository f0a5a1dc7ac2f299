package org.hpcbench.analysis;

import java.util.LinkedHashMap;
import java.util.Map;
import org.hpcbench.config.ConfigurationException;

/**
 * Percent-change thresholds beyond which a metric counts as regressed.
 */
public final class RegressionThresholds {
    public static final String LATENCY_PCT = "latency_pct";
    public static final String THROUGHPUT_PCT = "throughput_pct";
    public static final String SUCCESS_RATE_PCT = "success_rate_pct";

    private static final RegressionThresholds DEFAULTS = new RegressionThresholds(10.0d, 10.0d, 1.0d);

    private final double latencyPct;
    private final double throughputPct;
    private final double successRatePct;

    public RegressionThresholds(double latencyPct, double throughputPct, double successRatePct) {
        this.latencyPct = requireThreshold(latencyPct, LATENCY_PCT);
        this.throughputPct = requireThreshold(throughputPct, THROUGHPUT_PCT);
        this.successRatePct = requireThreshold(successRatePct, SUCCESS_RATE_PCT);
    }

    /**
     * 10% latency, 10% throughput, 1% success rate.
     */
    public static RegressionThresholds defaults() {
        return DEFAULTS;
    }

    /**
     * These thresholds with the given overrides applied.
     *
     * @throws ConfigurationException for unknown keys or values that are not non-negative numbers
     */
    public RegressionThresholds merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        double latency = latencyPct;
        double throughput = throughputPct;
        double successRate = successRatePct;
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            double value = toNumber(entry.getKey(), entry.getValue());
            switch (String.valueOf(entry.getKey())) {
                case LATENCY_PCT -> latency = value;
                case THROUGHPUT_PCT -> throughput = value;
                case SUCCESS_RATE_PCT -> successRate = value;
                default -> throw new ConfigurationException("unknown regression threshold: " + entry.getKey());
            }
        }
        return new RegressionThresholds(latency, throughput, successRate);
    }

    public double latencyPct() {
        return latencyPct;
    }

    public double throughputPct() {
        return throughputPct;
    }

    public double successRatePct() {
        return successRatePct;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(LATENCY_PCT, latencyPct);
        map.put(THROUGHPUT_PCT, throughputPct);
        map.put(SUCCESS_RATE_PCT, successRatePct);
        return map;
    }

    private static double toNumber(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ConfigurationException("regression threshold " + key + " must be a number: " + value);
    }

    private static double requireThreshold(double value, String key) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new ConfigurationException("regression threshold " + key + " must be a non-negative number: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RegressionThresholds)) {
            return false;
        }
        RegressionThresholds that = (RegressionThresholds) other;
        return Double.compare(latencyPct, that.latencyPct) == 0
            && Double.compare(throughputPct, that.throughputPct) == 0
            && Double.compare(successRatePct, that.successRatePct) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(latencyPct) * 31 * 31 + Double.hashCode(throughputPct) * 31 + Double.hashCode(successRatePct);
    }

    @Override
    public String toString() {
        return "RegressionThresholds" + toMap();
    }
}

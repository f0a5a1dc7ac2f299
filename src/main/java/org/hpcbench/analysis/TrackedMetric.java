package org.hpcbench.analysis;

/**
 * Summary metrics compared between a baseline and a current campaign.
 */
public enum TrackedMetric {
    SUCCESS_RATE("success_rate", "Success Rate (%)", MetricDirection.HIGHER_IS_BETTER) {
        @Override
        double thresholdFrom(RegressionThresholds thresholds) {
            return thresholds.successRatePct();
        }
    },
    AVG_LATENCY("latency_s.avg", "Avg Latency (s)", MetricDirection.LOWER_IS_BETTER) {
        @Override
        double thresholdFrom(RegressionThresholds thresholds) {
            return thresholds.latencyPct();
        }
    },
    P95_LATENCY("latency_s.p95", "P95 Latency (s)", MetricDirection.LOWER_IS_BETTER) {
        @Override
        double thresholdFrom(RegressionThresholds thresholds) {
            return thresholds.latencyPct();
        }
    },
    P99_LATENCY("latency_s.p99", "P99 Latency (s)", MetricDirection.LOWER_IS_BETTER) {
        @Override
        double thresholdFrom(RegressionThresholds thresholds) {
            return thresholds.latencyPct();
        }
    },
    THROUGHPUT("requests_per_second", "Throughput (RPS)", MetricDirection.HIGHER_IS_BETTER) {
        @Override
        double thresholdFrom(RegressionThresholds thresholds) {
            return thresholds.throughputPct();
        }
    };

    private final String path;
    private final String label;
    private final MetricDirection direction;

    TrackedMetric(String path, String label, MetricDirection direction) {
        this.path = path;
        this.label = label;
        this.direction = direction;
    }

    /**
     * Dotted path into the persisted summary.
     */
    public String path() {
        return path;
    }

    public String label() {
        return label;
    }

    public MetricDirection direction() {
        return direction;
    }

    abstract double thresholdFrom(RegressionThresholds thresholds);
}

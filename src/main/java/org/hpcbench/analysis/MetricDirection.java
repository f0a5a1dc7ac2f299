package org.hpcbench.analysis;

/**
 * Which way a tracked metric has to move to count as a regression.
 */
public enum MetricDirection {
    LOWER_IS_BETTER {
        @Override
        boolean regressed(double percentChange, double threshold) {
            return percentChange > threshold;
        }

        @Override
        boolean improved(double percentChange, double threshold) {
            return percentChange < -threshold;
        }
    },
    HIGHER_IS_BETTER {
        @Override
        boolean regressed(double percentChange, double threshold) {
            return percentChange < -threshold;
        }

        @Override
        boolean improved(double percentChange, double threshold) {
            return percentChange > threshold;
        }
    };

    abstract boolean regressed(double percentChange, double threshold);

    abstract boolean improved(double percentChange, double threshold);
}

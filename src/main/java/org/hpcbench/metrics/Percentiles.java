package org.hpcbench.metrics;

import java.util.Arrays;
import java.util.Collection;

/**
 * Sample statistics over latency values.
 */
public final class Percentiles {
    private Percentiles() {}

    /**
     * Percentile by linear interpolation between closest ranks (inclusive method, rank
     * {@code p/100 * (n-1)}).
     *
     * @param sorted ascending sample, non-empty
     * @param percentile value in [0, 100]
     */
    public static double interpolated(final double[] sorted, final double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("sample must not be empty");
        }
        if (!Double.isFinite(percentile) || percentile < 0.0d || percentile > 100.0d) {
            throw new IllegalArgumentException("percentile must be within [0, 100]");
        }
        final double rank = percentile / 100.0d * (sorted.length - 1);
        final int lower = (int) Math.floor(rank);
        final int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        final double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static double mean(final double[] values) {
        if (values.length == 0) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n-1 denominator); 0 for fewer than two values.
     */
    public static double sampleStandardDeviation(final double[] values) {
        if (values.length < 2) {
            return 0.0d;
        }
        final double mean = mean(values);
        double squares = 0.0d;
        for (double value : values) {
            final double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    static double[] sortedCopy(final Collection<Double> values) {
        final double[] sorted = new double[values.size()];
        int index = 0;
        for (Double value : values) {
            sorted[index++] = value;
        }
        Arrays.sort(sorted);
        return sorted;
    }
}

package org.hpcbench.analysis;

import java.util.OptionalInt;

/**
 * Maximum-curvature knee finder for performance curves.
 *
 * <p>Both axes are normalized to [0, 1] independently. Derivatives use unit-spaced central
 * differences in the interior and one-sided differences at the ends; no smoothing is applied, so
 * very short curves are sensitive to noise.
 */
public final class KneeDetector {
    static final int MIN_POINTS = 3;
    private static final double EPSILON = 1e-10;

    private KneeDetector() {}

    /**
     * Index of the interior point with maximum curvature, or empty for fewer than three points.
     * Ties resolve to the lowest index.
     */
    public static OptionalInt findKnee(double[] x, double[] y) {
        double[] curvature = curvature(x, y);
        if (curvature.length < MIN_POINTS) {
            return OptionalInt.empty();
        }
        int knee = 1;
        for (int i = 2; i < curvature.length - 1; i++) {
            if (curvature[i] > curvature[knee]) {
                knee = i;
            }
        }
        return OptionalInt.of(knee);
    }

    /**
     * Curvature {@code |x'y'' - y'x''| / (x'^2 + y'^2)^1.5} at every point of the normalized curve.
     */
    static double[] curvature(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length");
        }
        if (x.length < MIN_POINTS) {
            return new double[0];
        }
        double[] xNorm = normalize(x);
        double[] yNorm = normalize(y);
        double[] dx = gradient(xNorm);
        double[] dy = gradient(yNorm);
        double[] ddx = gradient(dx);
        double[] ddy = gradient(dy);
        double[] curvature = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double numerator = Math.abs(dx[i] * ddy[i] - dy[i] * ddx[i]);
            double denominator = Math.pow(dx[i] * dx[i] + dy[i] * dy[i] + EPSILON, 1.5d);
            curvature[i] = numerator / denominator;
        }
        return curvature;
    }

    static double[] normalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("curve values must be finite");
            }
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min + EPSILON;
        double[] normalized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = (values[i] - min) / range;
        }
        return normalized;
    }

    static double[] gradient(double[] values) {
        int n = values.length;
        double[] gradient = new double[n];
        if (n < 2) {
            return gradient;
        }
        gradient[0] = values[1] - values[0];
        gradient[n - 1] = values[n - 1] - values[n - 2];
        for (int i = 1; i < n - 1; i++) {
            gradient[i] = (values[i + 1] - values[i - 1]) / 2.0d;
        }
        return gradient;
    }
}

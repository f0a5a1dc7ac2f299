package org.hpcbench.analysis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class KneeDetectorTest {
    private static final double[] CONCURRENCY = {1, 2, 4, 8, 16, 32};

    @Test
    void findsThroughputPlateauOnset() {
        double[] throughput = {10, 20, 38, 45, 47, 48};

        OptionalInt knee = KneeDetector.findKnee(CONCURRENCY, throughput);

        assertTrue(knee.isPresent());
        assertEquals(3, knee.getAsInt());
    }

    @Test
    void kneeIsAlwaysAnInteriorPoint() {
        double[] latency = {0.10, 0.12, 0.20, 0.45, 1.2, 3.0};

        int knee = KneeDetector.findKnee(CONCURRENCY, latency).getAsInt();

        assertTrue(knee >= 1 && knee <= CONCURRENCY.length - 2);
    }

    @Test
    void shortCurvesHaveNoKnee() {
        assertFalse(KneeDetector.findKnee(new double[] {1, 2}, new double[] {5, 9}).isPresent());
        assertFalse(KneeDetector.findKnee(new double[0], new double[0]).isPresent());
        assertEquals(0, KneeDetector.curvature(new double[] {1}, new double[] {1}).length);
    }

    @Test
    void gradientUsesCentralDifferencesInside() {
        assertArrayEquals(new double[] {1, 2, 4, 5}, KneeDetector.gradient(new double[] {0, 1, 4, 9}), 1e-12);
    }

    @Test
    void normalizationMapsIntoUnitInterval() {
        double[] normalized = KneeDetector.normalize(new double[] {5, 10, 15});

        assertEquals(0.0d, normalized[0], 1e-9);
        assertEquals(0.5d, normalized[1], 1e-9);
        assertEquals(1.0d, normalized[2], 1e-9);
        assertArrayEquals(new double[] {0, 0, 0}, KneeDetector.normalize(new double[] {7, 7, 7}), 1e-9);
    }

    @Test
    void rejectsMismatchedOrNonFiniteInput() {
        assertThrows(IllegalArgumentException.class,
            () -> KneeDetector.findKnee(new double[] {1, 2, 3}, new double[] {1, 2}));
        assertThrows(IllegalArgumentException.class,
            () -> KneeDetector.findKnee(new double[] {1, 2, 3}, new double[] {1, Double.NaN, 3}));
    }
}

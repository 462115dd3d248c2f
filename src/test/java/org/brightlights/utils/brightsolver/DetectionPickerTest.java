package org.brightlights.utils.brightsolver;

import org.brightlights.utils.dataonly.CumulativeResponse;
import org.brightlights.utils.dataonly.Detection;
import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.ThresholdMode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DetectionPickerTest {

    private static final List<GridNode> NODES = List.of(
            new GridNode(45.0, 38.0, 5.0),
            new GridNode(45.1, 38.1, 10.0));

    private static CumulativeResponse response(double[] values, int owner) {
        int[] owners = new int[values.length];
        Arrays.fill(owners, owner);
        return new CumulativeResponse(values, owners);
    }

    private static double[] noise(int n, long seed) {
        Random rnd = new Random(seed);
        double[] x = new double[n];
        for (int i = 0; i < n; ++i) x[i] = 1.0 + rnd.nextDouble();
        return x;
    }

    @Test
    void testThresholdModes() {
        double[] x = {1, -2, 3, -4, 5};

        assertEquals(3 * 2.0, DetectionPicker.resolveThreshold(x, ThresholdMode.MAD, 2.0), 1e-12);
        assertEquals(7.5, DetectionPicker.resolveThreshold(x, ThresholdMode.ABS, 7.5), 0.0);
        assertEquals(Math.sqrt(55.0 / 5) * 3, DetectionPicker.resolveThreshold(x, ThresholdMode.RMS, 3.0), 1e-12);
    }

    @Test
    void testSingleSpikeDetection() {
        double[] x = noise(200, 1);
        x[120] = 50.0;

        DetectionPicker picker = new DetectionPicker(ThresholdMode.MAD, 10, 1.0);
        List<Detection> d = picker.findDetections(response(x, 1), NODES, 20.0, List.of("A", "B"));

        assertEquals(1, d.size());
        Detection det = d.get(0);
        assertEquals(6.0, det.detectTime(), 1e-12);
        assertEquals(NODES.get(1).key(), det.nodeKey());
        assertEquals(1, det.nodeIndex());
        assertEquals(50.0, det.peakValue(), 0.0);
        assertEquals(2, det.stationCount());
        assertEquals(List.of("A", "B"), det.stations());
        assertEquals(Detection.BRIGHTNESS, det.method());
    }

    @Test
    void testEmptyResultIsValid() {
        DetectionPicker picker = new DetectionPicker(ThresholdMode.ABS, 1e6, 1.0);
        assertTrue(picker.findDetections(response(noise(50, 2), 0), NODES, 10.0, List.of("A")).isEmpty());
    }

    @Test
    void testMinimumSeparationKeepsHigherPeak() {
        double[] x = new double[100];
        x[40] = 10.0;
        x[44] = 12.0;
        x[80] = 11.0;

        List<DetectionPicker.Peak> peaks = DetectionPicker.findPeaks(x, 5.0, 10);

        assertEquals(2, peaks.size());
        assertEquals(44, peaks.get(0).sample());
        assertEquals(80, peaks.get(1).sample());
    }

    @Test
    void testAcceptedPeaksRespectSeparation() {
        double[] x = noise(2000, 3);
        Random rnd = new Random(4);
        for (int k = 0; k < 60; ++k) x[rnd.nextInt(x.length)] = 10 + rnd.nextInt(40);

        int separation = 25;
        List<DetectionPicker.Peak> peaks = DetectionPicker.findPeaks(x, 5.0, separation);

        for (int i = 1; i < peaks.size(); ++i) {
            assertTrue(peaks.get(i).sample() - peaks.get(i - 1).sample() >= separation);
        }
        assertFalse(peaks.isEmpty());
    }

    @Test
    void testFractionalSeparationRoundedUp() {
        double[] x = new double[50];
        x[10] = 9.0;
        x[12] = 8.0;

        // 0.24 с при 10 Hz = 2.4 сэмпла: пики через 2 сэмпла (0.2 с) слишком близко
        DetectionPicker picker = new DetectionPicker(ThresholdMode.ABS, 1.0, 0.24);
        List<Detection> d = picker.findDetections(response(x, 0), NODES, 10.0, List.of("A"));

        assertEquals(1, d.size());
        assertEquals(1.0, d.get(0).detectTime(), 1e-12);
    }

    @Test
    void testDetectionTimesRespectSeparationInSeconds() {
        double[] x = noise(2000, 8);
        Random rnd = new Random(9);
        for (int k = 0; k < 200; ++k) x[rnd.nextInt(x.length)] = 10 + rnd.nextDouble() * 40;

        double minSeparation = 0.37;
        DetectionPicker picker = new DetectionPicker(ThresholdMode.ABS, 5.0, minSeparation);
        List<Detection> d = picker.findDetections(response(x, 0), NODES, 20.0, List.of("A"));

        assertFalse(d.isEmpty());
        for (int i = 1; i < d.size(); ++i) {
            double gap = d.get(i).detectTime() - d.get(i - 1).detectTime();
            assertTrue(gap >= minSeparation - 1e-9, "gap " + gap + " at " + i);
        }
    }

    @Test
    void testRaisingThresholdNeverAddsDetections() {
        double[] x = noise(3000, 5);
        Random rnd = new Random(6);
        for (int k = 0; k < 100; ++k) x[rnd.nextInt(x.length)] = 5 + rnd.nextDouble() * 40;

        int previous = Integer.MAX_VALUE;
        for (double m = 1.0; m <= 40.0; m += 0.5) {
            DetectionPicker picker = new DetectionPicker(ThresholdMode.MAD, m, 1.0);
            int count = picker.findDetections(response(x, 0), NODES, 10.0, List.of("A")).size();
            assertTrue(count <= previous, "multiplier " + m + ": " + count + " > " + previous);
            previous = count;
        }
    }

    @Test
    void testNonFiniteValuesReplacedWithZero() {
        double[] x = noise(100, 7);
        x[10] = Double.NaN;
        x[11] = Double.POSITIVE_INFINITY;
        x[60] = 40.0;

        DetectionPicker picker = new DetectionPicker(ThresholdMode.ABS, 20, 1.0);
        List<Detection> d = picker.findDetections(response(x, 0), NODES, 10.0, List.of("A"));

        assertEquals(1, d.size());
        assertEquals(6.0, d.get(0).detectTime(), 1e-12);
        assertTrue(Double.isNaN(x[10]), "input must not be modified");
    }

    @Test
    void testPlateauPickedOnce() {
        double[] x = new double[20];
        x[5] = 9.0;
        x[6] = 9.0;
        x[7] = 9.0;

        List<DetectionPicker.Peak> peaks = DetectionPicker.findPeaks(x, 1.0, 0);

        assertEquals(1, peaks.size());
        assertEquals(5, peaks.get(0).sample());
    }
}

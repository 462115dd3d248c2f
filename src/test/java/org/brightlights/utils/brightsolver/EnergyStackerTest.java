package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.JacksonConfigParser;
import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.LagGrid;
import org.brightlights.utils.dataonly.SamplePrecision;
import org.brightlights.utils.dataonly.Waveform;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnergyStackerTest {

    private static final LocalDateTime START = LocalDateTime.of(2021, 3, 1, 12, 0);

    private static EnergyStacker stacker(double clipLevel) {
        BrightnessConfig config = JacksonConfigParser.fromString("{\"clipLevel\": " + clipLevel + "}");
        return new EnergyStacker(config);
    }

    private static double[] spike(int n, int at, double value) {
        double[] x = new double[n];
        x[at] = value;
        return x;
    }

    @Test
    void testShiftSquareAndNormalize() {
        double[] e = stacker(1000).stationEnergy(spike(100, 41, 3.0), 0.2, 10.0);

        // Сдвиг на 2 сэмпла, одна ненулевая точка: rms = 9 / 10
        assertEquals(100, e.length);
        assertEquals(10.0, e[39], 1e-9);
        assertEquals(0.0, e[41], 0.0);
    }

    @Test
    void testTailIsZeroAfterShift() {
        double[] x = new double[10];
        Arrays.fill(x, 1.0);

        double[] e = stacker(1000).stationEnergy(x, 0.3, 10.0);

        for (int t = 7; t < 10; ++t) assertEquals(0.0, e[t], 0.0);
        assertTrue(e[0] > 0);
    }

    @Test
    void testClipping() {
        double[] x = new double[10];
        x[0] = 10.0;
        x[1] = 1.0;

        // mean = 10.1, потолок 2 * 10.1 = 20.2: большой отсчёт срезан
        double[] e = stacker(2).stationEnergy(x, 0.0, 1.0);

        assertEquals(20.2 / rmsOf(20.2, 1.0, 10), e[0], 1e-9);
        assertEquals(1.0 / rmsOf(20.2, 1.0, 10), e[1], 1e-9);
    }

    private static double rmsOf(double a, double b, int n) {
        return Math.sqrt((a * a + b * b) / n);
    }

    @Test
    void testSilentStationContributesZeros() {
        double[] e = stacker(100).stationEnergy(new double[50], 0.0, 10.0);
        for (double v : e) assertEquals(0.0, v, 0.0);
    }

    @Test
    void testStackSumsStationsAndSkipsMissing() {
        LagGrid grid = new LagGrid(
                List.of("A", "B", "C"),
                List.of(new GridNode(0, 0, 1)),
                new double[][]{{0.1}, {0.1}, {0.0}});

        List<Waveform> wf = List.of(
                new Waveform("XX", "A", "HHZ", 10.0, START, spike(100, 41, 1.0)),
                new Waveform("XX", "B", "HHZ", 10.0, START, spike(100, 41, 1.0)),
                new Waveform("XX", "B", "HHN", 10.0, START, spike(100, 10, 1.0)));

        double[] e = stacker(1000).stackNode(grid, 0, wf);

        // Станция C без данных пропущена, у B взят первый канал
        assertEquals(20.0, e[40], 1e-9);
        assertEquals(0.0, e[9], 0.0);
    }

    @Test
    void testNoStationMatchedGivesZeroTrace() {
        LagGrid grid = new LagGrid(List.of("Q"), List.of(new GridNode(0, 0, 1)), new double[][]{{0.0}});
        List<Waveform> wf = List.of(new Waveform("XX", "A", "HHZ", 10.0, START, spike(30, 3, 1.0)));

        double[] e = stacker(100).stackNode(grid, 0, wf);

        assertEquals(30, e.length);
        for (double v : e) assertEquals(0.0, v, 0.0);
    }

    @Test
    void testFloatPrecisionRoundsSamples() {
        double[] x = {0.1, 1.0 / 3.0};

        double[] narrowed = SamplePrecision.FLOAT.apply(x);

        assertEquals((float) 0.1, narrowed[0], 0.0);
        assertNotEquals(x[1], narrowed[1]);
        assertSame(x, SamplePrecision.DOUBLE.apply(x));
    }
}

package org.brightlights;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.JacksonConfigParser;
import org.brightlights.utils.dataonly.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозной сценарий: 3 станции, 9 узлов, 10 Hz, импульс на сэмпле 41 у каждой станции.
 * Лаги в сэмплах: A = [0,1,2,0,1,2,0,1,2], B = [2,1,0,2,1,0,2,1,0], C = [0,0,0,1,1,1,2,2,2].
 * Только у узла 4 все три лага равны 1, и только там три вклада складываются в один сэмпл.
 */
class BrightnessAppTest {

    @TempDir
    Path tempDir;

    private static final double FS = 10.0;
    private static final LocalDateTime START = LocalDateTime.of(2021, 5, 17, 12, 0);

    private static final int[][] LAG_SAMPLES = {
            {0, 1, 2, 0, 1, 2, 0, 1, 2},
            {2, 1, 0, 2, 1, 0, 2, 1, 0},
            {0, 0, 0, 1, 1, 1, 2, 2, 2}
    };

    private static LagGrid nineNodeGrid() {
        List<GridNode> nodes = new ArrayList<>();
        for (int i = 0; i < 9; ++i) nodes.add(new GridNode(45.0 + i / 3, 38.0 + i % 3, 10.0));

        double[][] lags = new double[3][9];
        for (int s = 0; s < 3; ++s) {
            for (int i = 0; i < 9; ++i) lags[s][i] = LAG_SAMPLES[s][i] / FS;
        }
        return new LagGrid(List.of("A", "B", "C"), nodes, lags);
    }

    private static List<Waveform> spikes(String... stations) {
        List<Waveform> out = new ArrayList<>();
        for (String st : stations) {
            double[] x = new double[100];
            x[41] = 1.0;
            out.add(new Waveform("XX", st, "HHZ", FS, START, x));
        }
        return out;
    }

    private BrightnessConfig config(boolean outOfCore, String extra) {
        String scratch = tempDir.resolve("scratch").toString().replace('\\', '/');
        String output = tempDir.resolve("out").toString().replace('\\', '/');
        return JacksonConfigParser.fromString("{"
                + "\"clipLevel\": 1000,"
                + "\"thresholdMode\": \"ABS\","
                + "\"thresholdMultiplier\": 25,"
                + "\"templateLength\": 1.0,"
                + "\"templatePrePick\": 0.2,"
                + "\"coherenceThreshold\": 0.5,"
                + "\"cores\": 3,"
                + "\"outOfCore\": " + outOfCore + ","
                + "\"scratchDirectory\": \"" + scratch + "\","
                + "\"outputDirectory\": \"" + output + "\""
                + extra
                + "}");
    }

    private void assertSingleDetectionAtCentre(BrightnessResult result) {
        assertEquals(1, result.detections().size());
        Detection d = result.detections().get(0);
        assertEquals(4, d.nodeIndex());
        assertEquals(nineNodeGrid().nodes().get(4).key(), d.nodeKey());
        assertEquals(4.0, d.detectTime(), 1e-9);
        assertEquals(30.0, d.peakValue(), 1e-9);
        assertEquals(25.0, d.threshold(), 0.0);
        assertEquals(List.of("A", "B", "C"), d.stations());

        assertEquals(1, result.templates().size());
        AcceptedTemplate t = result.templates().get(0);
        assertEquals(1.0, t.coherence(), 1e-9);
        assertEquals(3, t.window().channels().size());
        for (Waveform w : t.window().channels()) {
            assertEquals(10, w.length());
            assertEquals(1.0, w.samples()[2], 0.0);
        }
        assertEquals(Set.of(nineNodeGrid().nodes().get(4)), result.nodes());
    }

    @Test
    void testSpikeScenarioInMemory() throws IOException {
        BrightnessResult r = new BrightnessApp(config(false, "")).brightness(nineNodeGrid(), spikes("A", "B", "C"));
        assertSingleDetectionAtCentre(r);
    }

    @Test
    void testSpikeScenarioOutOfCore() throws IOException {
        BrightnessConfig c = config(true, ",\"instance\": \"spike\"");

        BrightnessResult r = new BrightnessApp(c).brightness(nineNodeGrid(), spikes("A", "B", "C"));

        assertSingleDetectionAtCentre(r);
        assertFalse(Files.exists(tempDir.resolve("scratch").resolve("tmpspike")), "scratch left behind");
    }

    @Test
    void testObserversReceiveAcceptedTemplates() throws IOException {
        BrightnessApp app = new BrightnessApp(config(false, ""));
        List<AcceptedTemplate> received = new ArrayList<>();
        TemplateObserver observer = received::add;
        app.attach(observer);

        app.brightness(nineNodeGrid(), spikes("A", "B", "C"));
        assertEquals(1, received.size());

        app.detach(observer);
        app.brightness(nineNodeGrid(), spikes("A", "B", "C"));
        assertEquals(1, received.size());
    }

    @Test
    void testStationWithoutDataIsNotCounted() throws IOException {
        BrightnessResult r = new BrightnessApp(config(false, ",\"thresholdMultiplier\": 15"))
                .brightness(nineNodeGrid(), spikes("A", "B"));

        assertFalse(r.detections().isEmpty());
        for (Detection d : r.detections()) {
            assertEquals(2, d.stationCount());
            assertEquals(List.of("A", "B"), d.stations());
        }
    }

    @Test
    void testHighThresholdGivesNoDetections() throws IOException {
        BrightnessResult r = new BrightnessApp(config(false, ",\"thresholdMultiplier\": 31"))
                .brightness(nineNodeGrid(), spikes("A", "B", "C"));

        assertTrue(r.detections().isEmpty());
        assertTrue(r.templates().isEmpty());
        assertTrue(r.nodes().isEmpty());
    }

    @Test
    void testMismatchedWaveformsRejected() {
        List<Waveform> wf = new ArrayList<>(spikes("A", "B"));
        wf.add(new Waveform("XX", "C", "HHZ", 20.0, START, new double[100]));

        BrightnessApp app = new BrightnessApp(config(false, ""));
        assertThrows(IllegalArgumentException.class, () -> app.brightness(nineNodeGrid(), wf));

        List<Waveform> shorter = new ArrayList<>(spikes("A", "B"));
        shorter.add(new Waveform("XX", "C", "HHZ", FS, START, new double[90]));
        assertThrows(IllegalArgumentException.class, () -> app.brightness(nineNodeGrid(), shorter));
    }

    @Test
    void testDeduplicationBeforeStacking() {
        // Узлы 0 и 3 отличаются только лагом станции C на 0.1 с
        BrightnessApp app = new BrightnessApp(config(false, ",\"nodeDedupThreshold\": 0.15"));

        LagGrid prepared = app.prepareGrid(nineNodeGrid());

        assertTrue(prepared.nodeCount() < 9);
        assertEquals(nineNodeGrid().nodes().get(0), prepared.nodes().get(0));
    }

    @Test
    void testNetworkResponseWritten() throws IOException {
        new BrightnessApp(config(false, ",\"writeNetworkResponse\": true"))
                .brightness(nineNodeGrid(), spikes("A", "B", "C"));

        try (var files = Files.list(tempDir.resolve("out"))) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("network_response_")));
        }
    }
}

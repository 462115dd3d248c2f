package org.brightlights.utils.incoming;

import org.brightlights.utils.dataonly.Waveform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MSeedWaveformReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testSeisFileTimeString() {
        LocalDateTime t = MSeedWaveformReader.transformedTime("2023,045,13:07:09.1234");

        assertEquals(LocalDateTime.of(2023, 2, 14, 13, 7, 9, 123_400_000), t);
        assertEquals(LocalDateTime.of(2023, 2, 14, 0, 0, 0),
                MSeedWaveformReader.transformedTime("2023,045,00:00:00"));
    }

    @Test
    void testBlocksMergedPerChannelInTimeOrder() {
        LocalDateTime t0 = LocalDateTime.of(2020, 1, 1, 10, 0);

        List<MSeedWaveformReader.Block> blocks = List.of(
                new MSeedWaveformReader.Block("XX", "AAA", "", "HHZ", 100, t0.plusSeconds(1), new double[]{3, 4}),
                new MSeedWaveformReader.Block("XX", "AAA", "", "HHN", 100, t0, new double[]{9}),
                new MSeedWaveformReader.Block("XX", "AAA", "", "HHZ", 100, t0, new double[]{1, 2}));

        List<Waveform> merged = MSeedWaveformReader.merge(blocks);

        assertEquals(2, merged.size());
        Waveform hhn = merged.get(0);
        Waveform hhz = merged.get(1);
        assertEquals("HHN", hhn.channel());
        assertEquals("HHZ", hhz.channel());
        assertArrayEquals(new double[]{1, 2, 3, 4}, hhz.samples(), 0.0);
        assertEquals(t0, hhz.startTime());
    }

    @Test
    void testEmptyDirectoryReadsNothing() throws IOException {
        assertTrue(new MSeedWaveformReader(tempDir).readAll().isEmpty());
    }

    @Test
    void testMissingDirectoryRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new MSeedWaveformReader(tempDir.resolve("nope")));
    }

    @Test
    void testTrimToCommonWindow() {
        LocalDateTime t0 = LocalDateTime.of(2020, 1, 1, 10, 0);
        Waveform early = new Waveform("XX", "A", "HHZ", 10, t0, new double[]{0, 1, 2, 3, 4, 5, 6, 7});
        Waveform late = new Waveform("XX", "B", "HHZ", 10, t0.plusNanos(200_000_000), new double[]{10, 11, 12, 13});

        List<Waveform> out = Waveform.trimToCommonWindow(List.of(early, late));

        assertArrayEquals(new double[]{2, 3, 4, 5}, out.get(0).samples(), 0.0);
        assertArrayEquals(new double[]{10, 11, 12, 13}, out.get(1).samples(), 0.0);
        assertEquals(out.get(0).startTime(), out.get(1).startTime());
    }
}

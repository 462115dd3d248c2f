package org.brightlights.utils.dataonly;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Одноканальная сейсмическая запись: то, с чем работает весь пайплайн яркости.
 * @param network код сети
 * @param station код станции (по нему идёт сопоставление с сеткой лагов)
 * @param channel код канала (BHZ, BHN, ...)
 * @param samplingRate частота дискретизации (Hz)
 * @param startTime время первого сэмпла (UTC)
 * @param samples амплитуды
 */
public record Waveform(String network,
                       String station,
                       String channel,
                       double samplingRate,
                       LocalDateTime startTime,
                       double[] samples) {

    public int length() { return samples.length; }

    /**
     * Идентификатор канала {@code NET.STA.CHAN} для логов.
     */
    public String id() {
        return network + "." + station + "." + channel;
    }

    /**
     * Копия с другими отсчётами (метаданные остаются прежними).
     */
    public Waveform withSamples(double[] newSamples, LocalDateTime newStart) {
        return new Waveform(network, station, channel, samplingRate, newStart, newSamples);
    }

    /**
     * Вырезает кусок записи {@code [from, from + count)} с проверкой границ.
     * Время начала куска сдвигается на {@code from / fs}.
     */
    public Waveform slice(int from, int count) {
        int start = Math.min(Math.max(0, from), samples.length);
        int end = Math.min(samples.length, from + count);
        if (end < start) end = start;

        double[] out = new double[end - start];
        System.arraycopy(samples, start, out, 0, out.length);

        return withSamples(out, startTime.plus(secondsToDuration(start / samplingRate)));
    }

    /**
     * Обрезка набора каналов до общего окна: самое позднее начало и самый ранний конец.
     * <br>Все каналы должны иметь одну частоту дискретизации.</br>
     * @param waveforms набор каналов
     * @return каналы одинаковой длины с одинаковым временем начала
     */
    public static List<Waveform> trimToCommonWindow(List<Waveform> waveforms) {
        if (waveforms.isEmpty()) return List.of();

        double fs = waveforms.get(0).samplingRate();
        LocalDateTime latestStart = waveforms.get(0).startTime();
        for (Waveform w : waveforms) {
            if (Math.abs(w.samplingRate() - fs) > 1e-9) {
                throw new IllegalArgumentException("Разные частоты дискретизации: "
                        + w.id() + " (" + w.samplingRate() + " Hz, ожидалось " + fs + " Hz)");
            }
            if (w.startTime().isAfter(latestStart)) latestStart = w.startTime();
        }

        List<Waveform> shifted = new ArrayList<>(waveforms.size());
        int common = Integer.MAX_VALUE;
        for (Waveform w : waveforms) {
            double offsetSec = Duration.between(w.startTime(), latestStart).toNanos() / 1e9;
            int offset = (int) Math.round(offsetSec * fs);
            Waveform cut = w.slice(offset, w.length() - offset);
            shifted.add(cut);
            common = Math.min(common, cut.length());
        }

        List<Waveform> out = new ArrayList<>(shifted.size());
        for (Waveform w : shifted) out.add(w.slice(0, common));
        return out;
    }

    static Duration secondsToDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1e9));
    }

    @Override public String toString() {
        return String.format("%s | %.1f Hz | %d samples | %s", id(), samplingRate, samples.length, startTime);
    }
}

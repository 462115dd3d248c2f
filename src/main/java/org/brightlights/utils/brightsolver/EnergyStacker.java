package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.dataonly.LagGrid;
import org.brightlights.utils.dataonly.Waveform;

import java.util.ArrayList;
import java.util.List;

/**
 * Расчёт «яркости» одного узла: сумма по станциям сдвинутых на лаг, клиппированных
 * и нормированных огибающих энергии.
 * <p>
 *     Узлы между собой не зависят — это и есть единица параллельной работы
 *     ({@link NodeWorkerPool}). Объект только читает общие данные, поэтому потокобезопасен.
 * </p>
 */
public class EnergyStacker {

    private final double clipLevel;

    public EnergyStacker(BrightnessConfig config) {
        this.clipLevel = config.clipLevel();
    }

    /**
     * Энергия узла по всем станциям сетки.
     * <ul>
     *     <li> Нет канала у станции — станция пропускается (предупреждение).
     *     <li> Несколько каналов — берётся первый (предупреждение).
     *     <li> Ни одной станции — нулевая трасса длины окна.
     * </ul>
     * @param grid таблица лагов
     * @param node индекс узла
     * @param waveforms записи (общая частота и длина)
     * @return трасса энергии узла длиной окна анализа
     */
    public double[] stackNode(LagGrid grid, int node, List<Waveform> waveforms) {
        int window = waveforms.isEmpty() ? 0 : waveforms.get(0).length();

        double[] energy = null;
        for (int s = 0; s < grid.stationCount(); ++s) {
            String station = grid.stations().get(s);

            Waveform match = firstMatch(station, waveforms, node);
            if (match == null) continue;

            double[] contribution = stationEnergy(match.samples(), grid.lag(s, node), match.samplingRate());

            // Затравка — вклад первой станции, дальше поэлементная сумма
            if (energy == null) {
                energy = contribution;
            } else {
                for (int t = 0; t < energy.length; ++t) energy[t] += contribution[t];
            }
        }

        if (energy == null) {
            System.err.println("[⚠] Node " + node + ": no station matched, energy is zero");
            return new double[window];
        }
        return energy;
    }

    /**
     * Вклад одной станции:
     * <ol>
     *     <li> {@code e[t] = x[t + shift]^2}, {@code shift = round(lag * fs)}, хвост — нули;
     *     <li> клиппинг до {@code clipLevel * mean(e)};
     *     <li> нормировка на RMS клиппированной огибающей.
     * </ol>
     * @param samples амплитуды станции
     * @param lagSeconds лаг станции для узла
     * @param fs частота дискретизации
     * @return нормированная огибающая той же длины
     */
    public double[] stationEnergy(double[] samples, double lagSeconds, double fs) {
        int n = samples.length;
        int shift = (int) Math.round(lagSeconds * fs);

        double[] envelope = new double[n];
        for (int t = 0; t + shift < n; ++t) {
            double x = samples[t + shift];
            envelope[t] = x * x;
        }

        double mean = 0;
        for (double e : envelope) mean += e;
        mean /= n;

        double ceiling = clipLevel * mean;
        double sumSq = 0;
        for (int t = 0; t < n; ++t) {
            if (envelope[t] > ceiling) envelope[t] = ceiling;
            sumSq += envelope[t] * envelope[t];
        }

        double rms = Math.sqrt(sumSq / n);
        if (!(rms > 0)) {
            // Пустая огибающая: вклад нулевой, а не NaN
            System.err.println("[⚠] Silent channel after shift by " + shift + " samples, zero contribution");
            return new double[n];
        }

        for (int t = 0; t < n; ++t) envelope[t] /= rms;
        return envelope;
    }

    private Waveform firstMatch(String station, List<Waveform> waveforms, int node) {
        List<Waveform> matches = new ArrayList<>(1);
        for (Waveform w : waveforms) {
            if (station.equals(w.station())) matches.add(w);
        }

        if (matches.isEmpty()) {
            System.err.println("[⚠] Node " + node + ": no channel for station " + station + ", skipped");
            return null;
        }
        if (matches.size() > 1) {
            System.err.println("[⚠] Node " + node + ": " + matches.size() + " channels for station "
                    + station + ", using " + matches.get(0).id());
        }
        return matches.get(0);
    }
}

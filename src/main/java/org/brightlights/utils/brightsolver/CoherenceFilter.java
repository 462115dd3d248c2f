package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.dataonly.AcceptedTemplate;
import org.brightlights.utils.dataonly.TemplateWindow;
import org.brightlights.utils.dataonly.Waveform;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Фильтр шаблонов по когерентности: средний модуль коэффициента корреляции
 * (нулевой сдвиг) по всем уникальным парам каналов окна.
 */
public class CoherenceFilter {

    private final double coherenceThreshold;

    public CoherenceFilter(BrightnessConfig config) {
        this(config.coherenceThreshold());
    }

    public CoherenceFilter(double coherenceThreshold) {
        this.coherenceThreshold = coherenceThreshold;
    }

    /**
     * Проверка окна шаблона.
     * @param window кандидат
     * @return принятый шаблон, если когерентность строго выше порога
     */
    public Optional<AcceptedTemplate> accept(TemplateWindow window) {
        double score = coherence(window.channels());

        if (score > coherenceThreshold) {
            System.out.println("[✅] Template at " + window.node().key()
                    + " accepted, coherence " + String.format("%.3f", score));
            return Optional.of(new AcceptedTemplate(window, score));
        }

        System.out.println("[i] Template at " + window.node().key()
                + " discarded, coherence " + String.format("%.3f", score)
                + " <= " + coherenceThreshold);
        return Optional.empty();
    }

    /**
     * Оценка когерентности набора каналов, всегда {@code >= 0}.
     * <br>Каналы разной длины дополняются нулями до самого длинного: окно, начавшееся
     * в нулевом часу суток, дополняется спереди, остальные — сзади.</br>
     * @param channels окна каналов
     * @return {@code sum|r_ij| / (n(n-1)/2)}; меньше двух каналов — ноль
     */
    public double coherence(List<Waveform> channels) {
        int n = channels.size();
        if (n < 2) return 0.0;

        double[][] data = padToLongest(channels);

        double sum = 0;
        for (int i = 0; i < n; ++i) {
            for (int j = i + 1; j < n; ++j) {
                sum += Math.abs(zeroLagCorrelation(data[i], data[j]));
            }
        }
        return sum / (n * (n - 1) / 2.0);
    }

    /**
     * Коэффициент Пирсона на нулевом сдвиге. Постоянный канал даёт ноль.
     */
    static double zeroLagCorrelation(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n == 0) return 0.0;

        double meanA = 0, meanB = 0;
        for (int t = 0; t < n; ++t) {
            meanA += a[t];
            meanB += b[t];
        }
        meanA /= n;
        meanB /= n;

        double cov = 0, varA = 0, varB = 0;
        for (int t = 0; t < n; ++t) {
            double da = a[t] - meanA;
            double db = b[t] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }

        double norm = Math.sqrt(varA * varB);
        if (!(norm > 0)) return 0.0;

        double r = cov / norm;
        // Округление может вывести чуть за единицу
        return Math.max(-1.0, Math.min(1.0, r));
    }

    private static double[][] padToLongest(List<Waveform> channels) {
        int longest = 0;
        for (Waveform w : channels) longest = Math.max(longest, w.length());

        List<double[]> out = new ArrayList<>(channels.size());
        for (Waveform w : channels) {
            if (w.length() == longest) {
                out.add(w.samples());
                continue;
            }

            double[] padded = new double[longest];
            int missing = longest - w.length();
            if (w.startTime().getHour() == 0) {
                System.err.println("[⚠] Padding " + w.id() + " at the start by " + missing + " samples");
                System.arraycopy(w.samples(), 0, padded, missing, w.length());
            } else {
                System.err.println("[⚠] Padding " + w.id() + " at the end by " + missing + " samples");
                System.arraycopy(w.samples(), 0, padded, 0, w.length());
            }
            out.add(padded);
        }
        return out.toArray(new double[0][]);
    }
}

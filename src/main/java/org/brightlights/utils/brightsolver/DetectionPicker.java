package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.dataonly.CumulativeResponse;
import org.brightlights.utils.dataonly.Detection;
import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.ThresholdMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Поиск детекций в кумулятивном отклике сети по Frank et al. (2014).
 * <p>
 *     Кандидаты — локальные максимумы {@code |cnr|} выше порога. Они перебираются
 *     по убыванию значения, и кандидат принимается, только если до каждого уже принятого
 *     пика не меньше {@code minPeakSeparation} секунд. Более высокий пик всегда «выигрывает»
 *     окно исключения.
 * </p>
 * Кандидатство не зависит от порога, поэтому при большем множителе принятые пики —
 * это начало того же жадного перебора: детекций не может стать больше.
 */
public class DetectionPicker {

    private final ThresholdMode mode;
    private final double multiplier;
    private final double minPeakSeparation;

    public DetectionPicker(BrightnessConfig config) {
        this(config.thresholdMode(), config.thresholdMultiplier(), config.minPeakSeparation());
    }

    public DetectionPicker(ThresholdMode mode, double multiplier, double minPeakSeparation) {
        this.mode = mode;
        this.multiplier = multiplier;
        this.minPeakSeparation = minPeakSeparation;
    }

    /**
     * Пик в отклике: индекс сэмпла и значение.
     */
    public record Peak(int sample, double value) {}

    /**
     * Детекции в отклике.
     * @param cnr кумулятивный отклик с владельцами
     * @param nodes узлы сетки, по которой считался отклик
     * @param samplingRate частота дискретизации
     * @param stations станции, реально участвовавшие в прогоне
     * @return детекции по возрастанию времени; пустой список — нормальный исход
     * @throws IllegalStateException если после замены в отклике остались не-числа
     */
    public List<Detection> findDetections(CumulativeResponse cnr,
                                          List<GridNode> nodes,
                                          double samplingRate,
                                          List<String> stations) {
        double[] values = sanitize(cnr.values());

        double threshold = resolveThreshold(values, mode, multiplier);
        System.out.println("[i] Median of data is: " + median(values));
        System.out.println("[i] RMS of data is: " + rms(values));
        System.out.println("[i] MAD of data is: " + mad(values));
        System.out.println("[i] Threshold is set to: " + threshold);
        System.out.println("[i] Max of data is: " + max(values));

        // Округление вверх: пики не ближе заданного разноса в секундах
        int separation = (int) Math.ceil(minPeakSeparation * samplingRate - 1e-9);
        List<Peak> peaks = findPeaks(values, threshold, separation);

        List<Detection> detections = new ArrayList<>(peaks.size());
        for (Peak peak : peaks) {
            int owner = cnr.owners()[peak.sample()];
            detections.add(new Detection(
                    nodes.get(owner).key(),
                    owner,
                    peak.sample() / samplingRate,
                    stations.size(),
                    peak.value(),
                    threshold,
                    Detection.BRIGHTNESS,
                    stations
            ));
        }

        System.out.println("[i] I have found " + detections.size() + " possible detections");
        return detections;
    }

    /**
     * Порог по режиму: MAD — {@code median(|x|) * m}, ABS — {@code m}, RMS — {@code sqrt(mean(x^2)) * m}.
     */
    public static double resolveThreshold(double[] values, ThresholdMode mode, double multiplier) {
        return switch (mode) {
            case MAD -> mad(values) * multiplier;
            case ABS -> multiplier;
            case RMS -> rms(values) * multiplier;
        };
    }

    /**
     * Жадный выбор разнесённых пиков.
     * @param values отклик (без не-чисел)
     * @param threshold порог (строго выше)
     * @param separation минимальный разнос в сэмплах
     * @return пики по возрастанию индекса
     */
    public static List<Peak> findPeaks(double[] values, double threshold, int separation) {
        int n = values.length;
        List<Peak> candidates = new ArrayList<>();

        for (int i = 0; i < n; ++i) {
            double v = Math.abs(values[i]);
            if (!(v > threshold)) continue;

            // Локальный максимум; у плато берётся первый сэмпл
            boolean risesFromLeft = i == 0 || v > Math.abs(values[i - 1]);
            boolean notBelowRight = i == n - 1 || v >= Math.abs(values[i + 1]);
            if (risesFromLeft && notBelowRight) {
                candidates.add(new Peak(i, values[i]));
            }
        }

        candidates.sort(Comparator.comparingDouble((Peak p) -> -Math.abs(p.value()))
                .thenComparingInt(Peak::sample));

        List<Peak> accepted = new ArrayList<>();
        for (Peak c : candidates) {
            boolean farEnough = true;
            for (Peak a : accepted) {
                if (Math.abs(c.sample() - a.sample()) < separation) {
                    farEnough = false;
                    break;
                }
            }
            if (farEnough) accepted.add(c);
        }

        accepted.sort(Comparator.comparingInt(Peak::sample));
        return accepted;
    }

    /**
     * Копия отклика с заменой NaN и бесконечностей на ноль.
     */
    static double[] sanitize(double[] raw) {
        double[] out = raw.clone();
        for (int i = 0; i < out.length; ++i) {
            if (!Double.isFinite(out[i])) out[i] = 0.0;
        }
        for (double v : out) {
            if (!Double.isFinite(v)) {
                throw new IllegalStateException("Nans present in the network response");
            }
        }
        return out;
    }

    static double median(double[] x) {
        if (x.length == 0) return 0.0;
        double[] sorted = x.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : 0.5 * (sorted[mid - 1] + sorted[mid]);
    }

    static double mad(double[] x) {
        double[] abs = new double[x.length];
        for (int i = 0; i < x.length; ++i) abs[i] = Math.abs(x[i]);
        return median(abs);
    }

    static double rms(double[] x) {
        if (x.length == 0) return 0.0;
        double sum = 0;
        for (double v : x) sum += v * v;
        return Math.sqrt(sum / x.length);
    }

    private static double max(double[] x) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : x) m = Math.max(m, v);
        return m;
    }
}

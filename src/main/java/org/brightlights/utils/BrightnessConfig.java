package org.brightlights.utils;

import org.brightlights.utils.dataonly.SamplePrecision;
import org.brightlights.utils.dataonly.ThresholdMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Неизменяемый объект конфигурации прогона. Передаётся каждому компоненту
 * пайплайна при создании (никаких глобальных значений по умолчанию на уровне модулей).
 * <br>Загружается из JSON через {@link JacksonConfigParser}.</br>
 *
 * @param nodeDedupThreshold порог удаления узлов с похожим moveout (сек), {@code null} — не удалять
 * @param resample объём ресэмплинга сетки, {@code null} — не ресэмплировать
 * @param clipLevel множитель среднего для клиппинга энергии
 * @param thresholdMode режим порога
 * @param thresholdMultiplier множитель порога
 * @param templateLength длина шаблона (сек)
 * @param templatePrePick сколько секунд шаблона берётся до пика
 * @param minPeakSeparation минимальный разнос детекций (сек)
 * @param coherenceThreshold порог когерентности для принятия шаблона
 * @param cores бюджет ядер пула
 * @param outOfCore энергии узлов через scratch-хранилище, а не в памяти
 * @param scratchDirectory корень scratch-хранилища
 * @param instance идентификатор прогона (разный у параллельных прогонов)
 * @param phase фаза файлов времён пробега
 * @param phaseOut фаза, в которой нужны лаги
 * @param psRatio отношение скоростей P/S
 * @param samplePrecision точность отсчётов перед расчётом энергии
 * @param writeNetworkResponse сохранять ли CNR в текстовый файл
 * @param outputDirectory директория выходных файлов
 * @param stations станции прогона, пустой список — все станции из данных
 */
public record BrightnessConfig(Double nodeDedupThreshold,
                               ResampleVolume resample,
                               double clipLevel,
                               ThresholdMode thresholdMode,
                               double thresholdMultiplier,
                               double templateLength,
                               double templatePrePick,
                               double minPeakSeparation,
                               double coherenceThreshold,
                               int cores,
                               boolean outOfCore,
                               Path scratchDirectory,
                               String instance,
                               String phase,
                               String phaseOut,
                               double psRatio,
                               SamplePrecision samplePrecision,
                               boolean writeNetworkResponse,
                               Path outputDirectory,
                               List<String> stations) {

    public static final double DEFAULT_CLIP_LEVEL = 100.0;
    public static final double DEFAULT_THRESHOLD_MULTIPLIER = 10.0;
    public static final double DEFAULT_TEMPLATE_LENGTH = 6.0;
    public static final double DEFAULT_TEMPLATE_PRE_PICK = 0.2;
    public static final double DEFAULT_COHERENCE_THRESHOLD = 0.5;
    public static final double DEFAULT_PS_RATIO = 1.68;

    /**
     * Объём, до которого режется сетка.
     * @param minDepth верхняя граница по глубине (строго)
     * @param maxDepth нижняя граница по глубине (строго)
     * @param boundaryWkt полигон в WKT, координаты {@code lon lat}
     */
    public record ResampleVolume(double minDepth, double maxDepth, String boundaryWkt) {
        public ResampleVolume {
            Objects.requireNonNull(boundaryWkt, "boundaryWkt");
            if (minDepth >= maxDepth) {
                throw new IllegalArgumentException("minDepth (" + minDepth
                        + ") должна быть меньше maxDepth (" + maxDepth + ")");
            }
        }
    }

    public BrightnessConfig {
        Objects.requireNonNull(thresholdMode, "thresholdMode");
        Objects.requireNonNull(samplePrecision, "samplePrecision");
        Objects.requireNonNull(scratchDirectory, "scratchDirectory");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(instance, "instance");
        stations = List.copyOf(stations);

        if (clipLevel <= 0) throw new IllegalArgumentException("clipLevel должен быть > 0: " + clipLevel);
        if (templateLength <= 0) throw new IllegalArgumentException("templateLength должна быть > 0: " + templateLength);
        if (minPeakSeparation < 0) throw new IllegalArgumentException("minPeakSeparation < 0: " + minPeakSeparation);
        if (cores < 1) throw new IllegalArgumentException("cores должно быть >= 1: " + cores);
        if (psRatio <= 0) throw new IllegalArgumentException("psRatio должно быть > 0: " + psRatio);
        if (nodeDedupThreshold != null && nodeDedupThreshold < 0) {
            throw new IllegalArgumentException("nodeDedupThreshold < 0: " + nodeDedupThreshold);
        }
        if (!"P".equals(phase) && !"S".equals(phase)) throw new IllegalArgumentException("phase: " + phase);
        if (!"P".equals(phaseOut) && !"S".equals(phaseOut)) throw new IllegalArgumentException("phaseOut: " + phaseOut);
    }

    /**
     * Конфигурация со всеми значениями по умолчанию.
     */
    public static BrightnessConfig defaults() {
        return new BrightnessConfig(
                null,
                null,
                DEFAULT_CLIP_LEVEL,
                ThresholdMode.MAD,
                DEFAULT_THRESHOLD_MULTIPLIER,
                DEFAULT_TEMPLATE_LENGTH,
                DEFAULT_TEMPLATE_PRE_PICK,
                DEFAULT_TEMPLATE_LENGTH,
                DEFAULT_COHERENCE_THRESHOLD,
                Runtime.getRuntime().availableProcessors(),
                true,
                Paths.get(System.getProperty("user.dir")).resolve("tmp"),
                newInstanceId(),
                "S",
                "S",
                DEFAULT_PS_RATIO,
                SamplePrecision.DOUBLE,
                false,
                Paths.get(System.getProperty("user.dir")).resolve("brightness_out"),
                List.of()
        );
    }

    /**
     * Случайный короткий идентификатор прогона для scratch-хранилища.
     */
    public static String newInstanceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}

package org.brightlights.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.brightlights.utils.dataonly.SamplePrecision;
import org.brightlights.utils.dataonly.ThresholdMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Класс, предназначенный для парсинга конфигурации прогона из {@code JSON}
 * в готовый объект {@link BrightnessConfig}.
 * <br>Все ключи необязательные: отсутствующий ключ заменяется значением по умолчанию.</br>
 */
public class JacksonConfigParser implements Fileable {
/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок с:                                                                      │
    │  * Полями, которые используются в процессе парсинга.                         │
    │  * Конструктором и фабрикой для строкового JSON.                             │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    // Один маппер на парсер: дерево читается целиком
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Путь к файлу конфигурации.
     */
    private final Path configFile;

    public JacksonConfigParser(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Файл конфигурации не существует: " + configFile);
        }
        this.configFile = configFile;
    }

    /**
     * Чтение и разбор файла конфигурации.
     * @return готовая конфигурация
     * @throws IOException если файл не читается
     */
    public BrightnessConfig parse() throws IOException {
        System.out.println("[i] Reading configuration: " + configFile.toAbsolutePath());
        return fromString(Files.readString(configFile));
    }

    /**
     * Разбор конфигурации из строки {@code JSON}.
     * @param json строка с конфигурацией
     * @return готовая конфигурация
     * @throws BrightnessApplicationException если строка не является корректным JSON
     *          или значения противоречат друг другу
     */
    public static BrightnessConfig fromString(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException jpe) {
            throw new BrightnessApplicationException("Некорректный JSON конфигурации: "
                    + jpe.getOriginalMessage(), jpe);
        }
        if (root == null || !root.isObject()) {
            throw new BrightnessApplicationException("Конфигурация должна быть JSON-объектом");
        }

        try {
            return build(root);
        } catch (IllegalArgumentException iae) {
            throw new BrightnessApplicationException("Ошибка конфигурации: " + iae.getMessage(), iae);
        }
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок со сборкой конфигурации из дерева JSON                                  │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    private static BrightnessConfig build(JsonNode root) {
        BrightnessConfig d = BrightnessConfig.defaults();

        Double dedup = root.hasNonNull("nodeDedupThreshold")
                ? root.path("nodeDedupThreshold").asDouble()
                : d.nodeDedupThreshold();

        BrightnessConfig.ResampleVolume volume = d.resample();
        JsonNode resample = root.path("resample");
        if (resample.isObject()) {
            volume = new BrightnessConfig.ResampleVolume(
                    requiredDouble(resample, "minDepth"),
                    requiredDouble(resample, "maxDepth"),
                    requiredText(resample, "boundaryWkt")
            );
        }

        double templateLength = root.path("templateLength").asDouble(d.templateLength());

        // Разнос пиков по умолчанию равен длине шаблона
        double separation = root.has("minPeakSeparation")
                ? root.path("minPeakSeparation").asDouble()
                : templateLength;

        List<String> stations = new ArrayList<>();
        for (JsonNode st : root.path("stations")) {
            stations.add(st.asText());
        }

        return new BrightnessConfig(
                dedup,
                volume,
                root.path("clipLevel").asDouble(d.clipLevel()),
                root.has("thresholdMode")
                        ? ThresholdMode.parse(root.path("thresholdMode").asText())
                        : d.thresholdMode(),
                root.path("thresholdMultiplier").asDouble(d.thresholdMultiplier()),
                templateLength,
                root.path("templatePrePick").asDouble(d.templatePrePick()),
                separation,
                root.path("coherenceThreshold").asDouble(d.coherenceThreshold()),
                root.path("cores").asInt(d.cores()),
                root.path("outOfCore").asBoolean(d.outOfCore()),
                root.has("scratchDirectory")
                        ? Paths.get(root.path("scratchDirectory").asText())
                        : d.scratchDirectory(),
                root.path("instance").asText(d.instance()),
                root.path("phase").asText(d.phase()).toUpperCase(),
                root.path("phaseOut").asText(d.phaseOut()).toUpperCase(),
                root.path("psRatio").asDouble(d.psRatio()),
                root.has("samplePrecision")
                        ? SamplePrecision.valueOf(root.path("samplePrecision").asText().toUpperCase())
                        : d.samplePrecision(),
                root.path("writeNetworkResponse").asBoolean(d.writeNetworkResponse()),
                root.has("outputDirectory")
                        ? Paths.get(root.path("outputDirectory").asText())
                        : d.outputDirectory(),
                stations
        );
    }

    private static double requiredDouble(JsonNode parent, String field) {
        JsonNode v = parent.path(field);
        if (!v.isNumber()) {
            throw new IllegalArgumentException("resample." + field + " должно быть числом");
        }
        return v.asDouble();
    }

    private static String requiredText(JsonNode parent, String field) {
        JsonNode v = parent.path(field);
        if (!v.isTextual()) {
            throw new IllegalArgumentException("resample." + field + " должно быть строкой");
        }
        return v.asText();
    }

    @Override public Path correctPath() {
        return this.configFile;
    }
}

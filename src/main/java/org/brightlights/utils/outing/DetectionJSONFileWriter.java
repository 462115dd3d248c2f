package org.brightlights.utils.outing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.brightlights.utils.Fileable;
import org.brightlights.utils.dataonly.AcceptedTemplate;
import org.brightlights.utils.dataonly.Detection;
import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.TemplateObserver;
import org.brightlights.utils.dataonly.Waveform;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Финальный класс-наблюдатель, который каждый принятый шаблон дописывает
 * в отчёт {@code detections_<дата>.json} (файл перезаписывается целиком).
 * @see org.brightlights.BrightnessApp
 */
public final class DetectionJSONFileWriter implements TemplateObserver, Fileable {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDirectory;
    private final ArrayNode report = MAPPER.createArrayNode();

    public DetectionJSONFileWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Метод обновления: шаблон добавляется к отчёту, отчёт записывается заново.
     * @param accepted принятый шаблон
     */
    @Override public synchronized void update(AcceptedTemplate accepted) {
        report.add(toJson(accepted));

        Path p = correctPath();
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(
                    p.toAbsolutePath(),
                    MAPPER.writeValueAsString(report),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING
            );
            System.out.println("[✅] Detection report updated: " + p.toAbsolutePath());
        } catch (IOException ioe) {
            System.err.println("[❌] Writing file error as Observer!");
            System.err.println("-> Path: " + p.toAbsolutePath());
            System.err.println("-> Reason: " + ioe.getMessage());
        }
    }

    /**
     * Сколько шаблонов уже попало в отчёт.
     */
    public synchronized int size() {
        return report.size();
    }

    static ObjectNode toJson(AcceptedTemplate accepted) {
        Detection d = accepted.window().detection();
        GridNode node = accepted.node();

        ObjectNode o = MAPPER.createObjectNode();
        o.put("nodeKey", d.nodeKey());
        o.put("latitude", node.latitude());
        o.put("longitude", node.longitude());
        o.put("depth", node.depth());
        o.put("detectTime", d.detectTime());
        o.put("peakValue", d.peakValue());
        o.put("threshold", d.threshold());
        o.put("method", d.method());
        o.put("coherence", accepted.coherence());
        o.put("stationCount", d.stationCount());

        ArrayNode stations = o.putArray("stations");
        d.stations().forEach(stations::add);

        ArrayNode channels = o.putArray("channels");
        for (Waveform w : accepted.window().channels()) {
            ObjectNode c = channels.addObject();
            c.put("id", w.id());
            c.put("startTime", w.startTime().toString());
            c.put("samples", w.length());
        }
        return o;
    }

    @Override public Path correctPath() {
        return outputDirectory.resolve("detections_" + Fileable.formattedToday() + ".json");
    }
}

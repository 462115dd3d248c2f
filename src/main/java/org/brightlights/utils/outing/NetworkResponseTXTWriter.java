package org.brightlights.utils.outing;

import org.brightlights.utils.Fileable;
import org.brightlights.utils.dataonly.CumulativeResponse;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Сохранение кумулятивного отклика сети в текстовый файл:
 * строка на сэмпл, {@code <время> <значение> <узел>}.
 */
public class NetworkResponseTXTWriter implements Fileable {

    private final Path outputDirectory;

    public NetworkResponseTXTWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * @param cnr отклик с владельцами
     * @param samplingRate частота для колонки времени
     * @return путь к записанному файлу
     * @throws IOException ошибка записи
     */
    public Path save(CumulativeResponse cnr, double samplingRate) throws IOException {
        Path outPath = correctPath();

        // Сначала директория!
        Files.createDirectories(outputDirectory);

        try (BufferedWriter wr = Files.newBufferedWriter(outPath)) {
            for (int t = 0; t < cnr.length(); ++t) {
                wr.write(Double.toString(t / samplingRate));
                wr.write(' ');
                wr.write(Double.toString(cnr.values()[t]));
                wr.write(' ');
                wr.write(Integer.toString(cnr.owners()[t]));
                wr.newLine();
            }
        }

        System.out.println("[✅] Network response saved to: " + outPath.getFileName());
        return outPath;
    }

    @Override public Path correctPath() {
        return outputDirectory.resolve("network_response_" + Fileable.formattedToday() + ".txt");
    }
}

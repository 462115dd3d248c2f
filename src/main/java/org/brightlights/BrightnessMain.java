package org.brightlights;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.JacksonConfigParser;
import org.brightlights.utils.dataonly.BrightnessResult;
import org.brightlights.utils.outing.DetectionJSONFileWriter;

import java.nio.file.Path;
import java.nio.file.Paths;

public class BrightnessMain {

    public static void main(String[] args) {
        if (args.length != 3) {
            System.err.println("Usage: BrightnessMain <config.json> <travel-time dir> <mseed dir>");
            System.exit(2);
        }

        try {
            BrightnessConfig config = new JacksonConfigParser(Paths.get(args[0])).parse();

            // Построение консольного детектора и подписка записи отчёта
            BrightnessApp app = new BrightnessApp(config);
            app.attach(new DetectionJSONFileWriter(config.outputDirectory()));

            BrightnessResult result = app.run(Path.of(args[1]), Path.of(args[2]));
            System.out.println(">> " + result.templates().size() + " templates, "
                    + result.nodes().size() + " source nodes");
        } catch (Exception e) {
            e.printStackTrace();
            System.exit(1);
        }
    }
}

package org.brightlights.utils.gridstore;

import org.brightlights.utils.BrightnessApplicationException;
import org.brightlights.utils.Fileable;
import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.LagGrid;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Чтение времён пробега, посчитанных Grid2Time (NonLinLoc), в таблицу лагов.
 * <p>
 *     Для каждой станции ищется файл {@code *.<phase>.<station>.time.csv}, строки которого —
 *     {@code lat lon depth traveltime} через пробелы, в каноническом порядке узлов.
 * </p>
 * Времена переводятся в нужную фазу через отношение P/S и сдвигаются так,
 * чтобы минимум по станции был нулём: дальше важна только ОТНОСИТЕЛЬНАЯ задержка
 * между узлами, абсолютное время пробега отбрасывается.
 */
public class TravelTimeGridReader implements Fileable {

    private final Path gridDirectory;
    private final String phase;
    private final String phaseOut;
    private final double psRatio;

    public TravelTimeGridReader(Path gridDirectory, String phase, String phaseOut, double psRatio) {
        if (!Files.isDirectory(gridDirectory)) {
            throw new IllegalArgumentException("Директория сетки не существует: " + gridDirectory);
        }
        this.gridDirectory = gridDirectory;
        this.phase = Objects.requireNonNull(phase, "phase");
        this.phaseOut = Objects.requireNonNull(phaseOut, "phaseOut");
        this.psRatio = psRatio;
    }

    /**
     * Читает файлы для всех запрошенных станций.
     * <br>Станция без файла молча выпадает из прогона (с предупреждением);
     * если не нашлось ни одной — прогон невозможен.</br>
     * @param stations запрошенные станции
     * @return таблица лагов
     * @throws IOException если найденный файл не читается
     * @throws BrightnessApplicationException если файлов нет совсем или сетки станций не совпадают
     */
    public LagGrid read(List<String> stations) throws IOException {
        List<String> found = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        List<GridNode> nodes = null;
        String firstStation = null;

        for (String station : stations) {
            Path file = locate(station);
            if (file == null) {
                System.err.println("[⚠] No travel-time file for station " + station + ", station excluded");
                continue;
            }

            System.out.println("[i] Reading travel times from: " + file.getFileName());
            List<GridNode> stationNodes = new ArrayList<>();
            double[] times = readRows(file, stationNodes);

            if (nodes == null) {
                nodes = stationNodes;
                firstStation = station;
            } else if (!nodes.equals(stationNodes)) {
                throw new BrightnessApplicationException("Сетка станции " + station
                        + " не совпадает с сеткой станции " + firstStation
                        + " (" + stationNodes.size() + " vs " + nodes.size() + " узлов)");
            }

            found.add(station);
            rows.add(toLags(times));
        }

        if (found.isEmpty()) {
            throw new BrightnessApplicationException("No travel-time files found in " + gridDirectory);
        }

        return new LagGrid(found, nodes, rows.toArray(new double[0][]));
    }

    /**
     * Перевод фазы и обнуление по минимуму.
     */
    double[] toLags(double[] travelTimes) {
        double[] out = travelTimes.clone();

        if (!phase.equals(phaseOut)) {
            for (int i = 0; i < out.length; ++i) {
                out[i] = "S".equals(phase) ? out[i] / psRatio : out[i] * psRatio;
            }
        }

        double min = Double.POSITIVE_INFINITY;
        for (double t : out) min = Math.min(min, t);
        for (int i = 0; i < out.length; ++i) out[i] -= min;

        return out;
    }

    private Path locate(String station) throws IOException {
        String glob = "*." + phase + "." + station + ".time.csv";
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(gridDirectory, glob)) {
            for (Path p : ds) matches.add(p);
        }
        if (matches.isEmpty()) return null;

        matches.sort(null);
        if (matches.size() > 1) {
            System.err.println("[⚠] Several travel-time files for " + station + ", using " + matches.get(0).getFileName());
        }
        return matches.get(0);
    }

    private double[] readRows(Path file, List<GridNode> nodesOut) throws IOException {
        List<Double> times = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(file)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty()) continue;

                String[] parts = line.split("\\s+");
                if (parts.length < 4) {
                    throw new IOException(file.getFileName() + ":" + lineNo + ": ожидалось 4 колонки, найдено " + parts.length);
                }
                try {
                    nodesOut.add(new GridNode(
                            Double.parseDouble(parts[0]),
                            Double.parseDouble(parts[1]),
                            Double.parseDouble(parts[2])));
                    times.add(Double.parseDouble(parts[3]));
                } catch (NumberFormatException nfe) {
                    throw new IOException(file.getFileName() + ":" + lineNo + ": " + nfe.getMessage(), nfe);
                }
            }
        }

        double[] out = new double[times.size()];
        for (int i = 0; i < out.length; ++i) out[i] = times.get(i);
        return out;
    }

    @Override public Path correctPath() {
        return this.gridDirectory;
    }
}

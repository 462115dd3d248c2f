package org.brightlights.utils.incoming;

import edu.sc.seis.seisFile.mseed.Blockette1000;
import edu.sc.seis.seisFile.mseed.DataHeader;
import edu.sc.seis.seisFile.mseed.DataRecord;
import edu.sc.seis.seisFile.mseed.SeedFormatException;
import edu.sc.seis.seisFile.mseed.SeedRecord;
import org.brightlights.utils.Fileable;
import org.brightlights.utils.dataonly.Waveform;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.*;

/**
 * Чтение всех {@code .mseed} файлов директории в набор {@link Waveform}.
 * <br>Блоки данных ({@code DataRecord}) группируются по {@code NET.STA.LOC.CHAN},
 * сортируются по времени начала и склеиваются в одну запись на канал.</br>
 */
public class MSeedWaveformReader implements Fileable {

    private final Path mseedDirectory;

    public MSeedWaveformReader(Path mseedDirectory) {
        if (!Files.isDirectory(mseedDirectory)) {
            throw new IllegalArgumentException("Директория с mseed не существует: " + mseedDirectory);
        }
        this.mseedDirectory = mseedDirectory;
    }

    /**
     * Блок сигнала из одного {@code DataRecord}.
     */
    record Block(String network, String station, String location, String channel,
                 double samplingRate, LocalDateTime startTime, double[] samples) {

        String channelKey() {
            return network + "." + station + "." + location + "." + channel;
        }
    }

    /**
     * Все каналы всех файлов директории.
     * @return записи в порядке ключей каналов
     * @throws IOException ошибка чтения файла
     */
    public List<Waveform> readAll() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(mseedDirectory, "*.mseed")) {
            for (Path p : ds) files.add(p);
        }
        Collections.sort(files);

        List<Block> blocks = new ArrayList<>();
        for (Path file : files) {
            blocks.addAll(readBlocks(file));
        }

        List<Waveform> waveforms = merge(blocks);
        System.out.println("[i] Read " + waveforms.size() + " channels from " + files.size() + " mseed files");
        return waveforms;
    }

    /**
     * Склейка блоков по каналам.
     */
    static List<Waveform> merge(List<Block> blocks) {
        Map<String, List<Block>> grouped = new TreeMap<>();
        for (Block block : blocks) {
            grouped.computeIfAbsent(block.channelKey(), k -> new ArrayList<>()).add(block);
        }

        List<Waveform> merged = new ArrayList<>(grouped.size());
        for (List<Block> channelBlocks : grouped.values()) {
            // Сортируем по времени начала!
            channelBlocks.sort(Comparator.comparing(Block::startTime));

            int total = 0;
            for (Block b : channelBlocks) total += b.samples().length;

            double[] samples = new double[total];
            int pos = 0;
            for (Block b : channelBlocks) {
                System.arraycopy(b.samples(), 0, samples, pos, b.samples().length);
                pos += b.samples().length;
            }

            Block head = channelBlocks.get(0);
            merged.add(new Waveform(head.network(), head.station(), head.channel(),
                    head.samplingRate(), head.startTime(), samples));
        }
        return merged;
    }

    private List<Block> readBlocks(Path file) throws IOException {
        List<Block> blocks = new ArrayList<>();

        try (DataInputStream dis = new DataInputStream(
                new BufferedInputStream(Files.newInputStream(file)))) {
            while (true) {
                try {
                    SeedRecord sr = DataRecord.read(dis, 0);
                    if (sr instanceof DataRecord rec) {
                        blocks.add(convert(rec));
                    }
                } catch (EOFException e) {
                    // Конец файла
                    break;
                } catch (SeedFormatException e) {
                    System.err.println("[⚠] Corrupted record skipped in " + file.getFileName()
                            + " (" + e.getMessage() + ")");
                }
            }
        }
        return blocks;
    }

    private Block convert(DataRecord rec) throws SeedFormatException {
        DataHeader header = rec.getHeader();

        return new Block(
                header.getNetworkCode().trim(),
                header.getStationIdentifier().trim(),
                header.getLocationIdentifier().trim(),
                header.getChannelIdentifier().trim(),
                rec.getSampleRate(),
                transformedTime(header.getStartTime()),
                decodeAmplitudes(rec)
        );
    }

    /**
     * Разбор строки времени seisFile: {@code ГГГГ,ДДД,ЧЧ:ММ:СС.ТТТТ}.
     */
    static LocalDateTime transformedTime(String raw) {
        raw = raw.trim();

        int year = Integer.parseInt(raw.substring(0, 4)),
                day = Integer.parseInt(raw.substring(5, 8)),
                hours = Integer.parseInt(raw.substring(9, 11)),
                minutes = Integer.parseInt(raw.substring(12, 14)),
                seconds = Integer.parseInt(raw.substring(15, 17));

        LocalDate date = LocalDate.ofYearDay(year, day);
        return LocalDateTime.of(date, LocalTime.of(hours, minutes, seconds, extractNanos(raw)));
    }

    private static int extractNanos(String raw) {
        int dotIndex = raw.indexOf('.', 17);
        if (dotIndex == -1) return 0;

        String frac = raw.substring(dotIndex + 1).replaceAll("[^0-9]", "");
        if (frac.isEmpty()) return 0;

        // Нормализация в наносекунды
        if (frac.length() > 9) {
            frac = frac.substring(0, 9);
        } else {
            frac = String.format("%-9s", frac).replace(' ', '0');
        }
        return Integer.parseInt(frac);
    }

    private double[] decodeAmplitudes(DataRecord record) throws SeedFormatException {
        final int INT16 = 1,
                INT32 = 3,
                STEIM1 = 10,
                STEIM2 = 11,
                FLOAT32 = 4,
                FLOAT64 = 5;

        try {
            Blockette1000 b1000 = (Blockette1000) record.getUniqueBlockette(1000);
            if (b1000 == null) {
                return toDouble(record.decompress().getAsInt());
            }

            return switch (b1000.getEncodingFormat()) {
                case INT16, INT32, STEIM1, STEIM2 -> toDouble(record.decompress().getAsInt());
                case FLOAT32, FLOAT64 -> record.decompress().getAsDouble();
                default -> throw new SeedFormatException(
                        "Unknown encoding for blockette #1000: " + b1000.getEncodingFormat());
            };
        } catch (SeedFormatException sfe) {
            throw sfe;
        } catch (Exception e) {
            // Ошибки кодека — тоже испорченная запись
            throw new SeedFormatException("Cannot decode record: " + e.getMessage(), e);
        }
    }

    private static double[] toDouble(int[] ints) {
        double[] d = new double[ints.length];
        for (int i = 0; i < ints.length; ++i) d[i] = ints[i];
        return d;
    }

    @Override public Path correctPath() {
        return this.mseedDirectory;
    }
}

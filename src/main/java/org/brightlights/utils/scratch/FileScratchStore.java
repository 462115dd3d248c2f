package org.brightlights.utils.scratch;

import org.brightlights.utils.Fileable;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Файловое scratch-хранилище: один бинарный файл на узел.
 * <br>Раскладка: {@code <root>/tmp<instance>/node_<i>.bin}, внутри — длина (int)
 * и отсчёты (double, big-endian).</br>
 * Разные прогоны живут в разных поддиректориях и не пересекаются.
 */
public class FileScratchStore implements ScratchStore, Fileable, AutoCloseable {

    private final Path instanceDirectory;
    private final String instance;

    public FileScratchStore(Path root, String instance) throws IOException {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.instanceDirectory = root.resolve("tmp" + instance);
        Files.createDirectories(instanceDirectory);
    }

    @Override public String instance() {
        return instance;
    }

    @Override public ScratchSlot write(int nodeIndex, double[] trace) throws IOException {
        ScratchSlot slot = slotOf(nodeIndex);

        try (DataOutputStream out = new DataOutputStream(
                new BufferedOutputStream(Files.newOutputStream(fileOf(slot))))) {
            out.writeInt(trace.length);
            for (double v : trace) out.writeDouble(v);
        }
        return slot;
    }

    @Override public double[] read(ScratchSlot slot) throws IOException {
        checkOwnership(slot);

        try (DataInputStream in = new DataInputStream(
                new BufferedInputStream(Files.newInputStream(fileOf(slot))))) {
            double[] trace = new double[in.readInt()];
            for (int i = 0; i < trace.length; ++i) trace[i] = in.readDouble();
            return trace;
        }
    }

    @Override public void delete(ScratchSlot slot) throws IOException {
        checkOwnership(slot);
        Files.deleteIfExists(fileOf(slot));
    }

    /**
     * Есть ли на диске файл этого слота.
     */
    public boolean exists(ScratchSlot slot) {
        return Files.exists(fileOf(slot));
    }

    /**
     * Удаляет оставшиеся слоты и директорию прогона.
     */
    @Override public void close() throws IOException {
        if (!Files.exists(instanceDirectory)) return;

        try (DirectoryStream<Path> ds = Files.newDirectoryStream(instanceDirectory, "node_*.bin")) {
            for (Path p : ds) Files.deleteIfExists(p);
        }
        Files.deleteIfExists(instanceDirectory);
    }

    private void checkOwnership(ScratchSlot slot) {
        if (!instance.equals(slot.instance())) {
            throw new IllegalArgumentException("Слот " + slot + " принадлежит другому прогону (этот: " + instance + ")");
        }
    }

    private Path fileOf(ScratchSlot slot) {
        return instanceDirectory.resolve("node_" + slot.nodeIndex() + ".bin");
    }

    @Override public Path correctPath() {
        return this.instanceDirectory;
    }
}

package org.brightlights.utils.brightsolver;

import org.brightlights.utils.dataonly.CumulativeResponse;
import org.brightlights.utils.scratch.ScratchSlot;
import org.brightlights.utils.scratch.ScratchStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Свёртка энергий всех узлов в кумулятивный отклик сети (CNR) с «происхождением»:
 * для каждого сэмпла запоминается узел, давший максимум.
 * <p>
 *     Правило ничьей везде одно: при равных значениях побеждает узел, набравший
 *     максимум первым, то есть с меньшим индексом (сравнение строго {@code >}).
 *     Поэтому разбиение на диапазоны никак не влияет на ответ.
 * </p>
 */
public class ResponseAggregator {

    /**
     * Непрерывный диапазон индексов узлов {@code [from, to)}.
     */
    public record NodeRange(int from, int to) {
        public int size() { return to - from; }
    }

    /**
     * Режим «в памяти»: все трассы доступны сразу, argmax по оси узлов.
     * @param traces {@code traces[node][sample]}
     * @return отклик и владельцы
     */
    public CumulativeResponse reduce(double[][] traces) {
        if (traces.length == 0) {
            throw new IllegalArgumentException("Нет ни одной трассы энергии");
        }

        double[] values = traces[0].clone();
        int[] owners = new int[values.length];

        for (int node = 1; node < traces.length; ++node) {
            fold(values, owners, traces[node], node);
        }
        return new CumulativeResponse(values, owners);
    }

    /**
     * Режим «не в памяти»: трассы лежат в scratch-хранилище.
     * <br>Каждый воркер сворачивает свой непрерывный диапазон узлов, удаляя слоты сразу
     * после использования; затем частичные результаты сворачиваются по порядку диапазонов.</br>
     * @param store хранилище со слотами всех узлов
     * @param nodeCount число узлов
     * @param pool общий пул воркеров
     * @return отклик и владельцы
     */
    public CumulativeResponse reduce(ScratchStore store, int nodeCount, NodeWorkerPool pool) {
        return reduce(store, partition(nodeCount, pool.size()), pool);
    }

    /**
     * То же, но с явным разбиением (диапазоны должны идти по порядку и покрывать все узлы).
     */
    public CumulativeResponse reduce(ScratchStore store, List<NodeRange> ranges, NodeWorkerPool pool) {
        checkPartition(ranges);

        List<Callable<CumulativeResponse>> tasks = new ArrayList<>(ranges.size());
        for (NodeRange range : ranges) {
            tasks.add(() -> foldRange(store, range));
        }

        List<CumulativeResponse> partials = pool.runAll(tasks);
        return mergePartials(partials);
    }

    /**
     * Разбиение {@code [0, nodeCount)} на {@code min(parts, nodeCount)} непрерывных диапазонов.
     * <br>Первые {@code nodeCount % parts} диапазонов длиннее на один узел;
     * без дыр и без пересечений.</br>
     */
    public static List<NodeRange> partition(int nodeCount, int parts) {
        if (nodeCount <= 0) throw new IllegalArgumentException("nodeCount должно быть > 0: " + nodeCount);
        if (parts <= 0) throw new IllegalArgumentException("parts должно быть > 0: " + parts);

        int chunks = Math.min(parts, nodeCount);
        int base = nodeCount / chunks;
        int extra = nodeCount % chunks;

        List<NodeRange> out = new ArrayList<>(chunks);
        int from = 0;
        for (int c = 0; c < chunks; ++c) {
            int to = from + base + (c < extra ? 1 : 0);
            out.add(new NodeRange(from, to));
            from = to;
        }
        return out;
    }

    /**
     * Последовательная свёртка одного диапазона из scratch-хранилища.
     */
    CumulativeResponse foldRange(ScratchStore store, NodeRange range) throws IOException {
        ScratchSlot first = store.slotOf(range.from());
        double[] values = store.read(first);
        store.delete(first);

        int[] owners = new int[values.length];
        Arrays.fill(owners, range.from());

        for (int node = range.from() + 1; node < range.to(); ++node) {
            ScratchSlot slot = store.slotOf(node);
            double[] energy = store.read(slot);
            fold(values, owners, energy, node);
            store.delete(slot);
        }
        return new CumulativeResponse(values, owners);
    }

    /**
     * Свёртка частичных результатов в порядке диапазонов.
     * Владельцы уже глобальные индексы, поэтому восстанавливать их не нужно.
     */
    CumulativeResponse mergePartials(List<CumulativeResponse> partials) {
        double[] values = partials.get(0).values().clone();
        int[] owners = partials.get(0).owners().clone();

        for (int p = 1; p < partials.size(); ++p) {
            CumulativeResponse part = partials.get(p);
            checkLength(values, part.values());
            for (int t = 0; t < values.length; ++t) {
                if (part.values()[t] > values[t]) {
                    values[t] = part.values()[t];
                    owners[t] = part.owners()[t];
                }
            }
        }
        return new CumulativeResponse(values, owners);
    }

    private static void fold(double[] values, int[] owners, double[] energy, int node) {
        checkLength(values, energy);
        for (int t = 0; t < values.length; ++t) {
            if (energy[t] > values[t]) {
                values[t] = energy[t];
                owners[t] = node;
            }
        }
    }

    private static void checkPartition(List<NodeRange> ranges) {
        if (ranges.isEmpty()) throw new IllegalArgumentException("Пустое разбиение узлов");

        int expected = 0;
        for (NodeRange r : ranges) {
            if (r.from() != expected || r.size() <= 0) {
                throw new IllegalArgumentException("Разбиение с дырой или пересечением: " + ranges);
            }
            expected = r.to();
        }
    }

    private static void checkLength(double[] expected, double[] actual) {
        if (expected.length != actual.length) {
            throw new IllegalStateException("Трассы энергии разной длины: "
                    + expected.length + " и " + actual.length);
        }
    }
}

package org.brightlights.utils.gridstore;

import org.brightlights.utils.dataonly.GridNode;
import org.brightlights.utils.dataonly.LagGrid;

import java.util.Arrays;

/**
 * Подготовка сетки лагов до начала расчёта энергий:
 * <ul>
 *     <li> ресэмплинг до под-объёма (глубина + полигон);
 *     <li> удаление узлов, чей moveout почти не отличается от уже оставленных.
 * </ul>
 * Оба шага возвращают новую {@link LagGrid}: выравнивание «станция → узел» сохраняется,
 * выброшенные узлы не восстанавливаются.
 */
public final class GridStore {

    // Блокируем возможность создать экземпляр класса
    private GridStore() {}

    /**
     * Оставляет только узлы с глубиной строго между {@code minDepth} и {@code maxDepth},
     * лежащие внутри полигона.
     * @param grid исходная сетка
     * @param minDepth верхняя граница (км)
     * @param maxDepth нижняя граница (км)
     * @param boundary граница в плане
     * @return урезанная сетка
     */
    public static LagGrid resample(LagGrid grid, double minDepth, double maxDepth, BoundaryPolygon boundary) {
        int[] kept = new int[grid.nodeCount()];
        int count = 0;

        for (int i = 0; i < grid.nodeCount(); ++i) {
            GridNode node = grid.nodes().get(i);
            if (minDepth < node.depth() && node.depth() < maxDepth
                    && boundary.contains(node.latitude(), node.longitude())) {
                kept[count++] = i;
            }
        }

        LagGrid out = grid.selectNodes(Arrays.copyOf(kept, count));
        System.out.println("[i] Grid now has " + out.nodeCount() + " nodes (was " + grid.nodeCount() + ")");
        return out;
    }

    /**
     * Расстояние moveout между двумя узлами: сумма по станциям модулей разности лагов (L1).
     */
    public static double moveoutDistance(LagGrid grid, int a, int b) {
        double sum = 0;
        for (int s = 0; s < grid.stationCount(); ++s) {
            sum += Math.abs(grid.lag(s, a) - grid.lag(s, b));
        }
        return sum;
    }

    /**
     * Жадное удаление почти-дубликатов.
     * <br>Узел 0 остаётся всегда; узел {@code i} остаётся, только если его расстояние
     * moveout до КАЖДОГО уже оставленного узла строго больше порога.</br>
     * @param grid исходная сетка
     * @param threshold порог в секундах
     * @return сетка без дубликатов, относительный порядок узлов сохранён
     */
    public static LagGrid deduplicate(LagGrid grid, double threshold) {
        int n = grid.nodeCount();
        if (n == 0) return grid;

        // Лаги узлов подряд в памяти: внутренний цикл идёт по станциям
        int stations = grid.stationCount();
        double[][] byNode = new double[n][];
        for (int i = 0; i < n; ++i) byNode[i] = grid.lagsOfNode(i);

        int[] kept = new int[n];
        int count = 0;
        kept[count++] = 0;

        int lastPercent = -1;
        for (int i = 1; i < n; ++i) {
            boolean distinguishable = true;

            for (int k = 0; k < count && distinguishable; ++k) {
                double[] other = byNode[kept[k]];
                double sum = 0;
                for (int s = 0; s < stations; ++s) sum += Math.abs(byNode[i][s] - other[s]);
                distinguishable = sum > threshold;
            }

            if (distinguishable) kept[count++] = i;

            int percent = (int) (100L * i / n);
            if (percent != lastPercent && percent % 10 == 0) {
                System.out.print("\r[i] Deduplicating nodes: " + percent + "%");
                lastPercent = percent;
            }
        }
        System.out.println();

        LagGrid out = grid.selectNodes(Arrays.copyOf(kept, count));
        System.out.println("[i] Removed " + (n - out.nodeCount()) + " duplicate nodes");
        return out;
    }
}

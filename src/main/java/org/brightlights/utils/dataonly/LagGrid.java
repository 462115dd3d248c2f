package org.brightlights.utils.dataonly;

import java.util.List;
import java.util.Objects;

/**
 * Таблица задержек (лагов) «станция → узел» в секундах.
 * <p>Главный инвариант: для любой станции {@code s} и любого индекса {@code i}
 * значение {@code lag(s, i)} описывает тот же физический узел, что и {@code nodes().get(i)}.
 * Поэтому все строки таблицы имеют одинаковую длину (= количество узлов).</p>
 * Объект неизменяемый: на вход и на выход отдаются копии массивов.
 */
public final class LagGrid {

    private final List<String> stations;
    private final List<GridNode> nodes;
    private final double[][] lags; // [станция][узел]

    public LagGrid(List<String> stations, List<GridNode> nodes, double[][] lags) {
        this.stations = List.copyOf(Objects.requireNonNull(stations, "stations"));
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        Objects.requireNonNull(lags, "lags");

        if (lags.length != this.stations.size()) {
            throw new IllegalArgumentException("Строк лагов " + lags.length
                    + ", а станций " + this.stations.size());
        }

        this.lags = new double[lags.length][];
        for (int s = 0; s < lags.length; ++s) {
            if (lags[s].length != this.nodes.size()) {
                throw new IllegalArgumentException("Станция " + this.stations.get(s) + ": лагов "
                        + lags[s].length + ", а узлов " + this.nodes.size());
            }
            for (double lag : lags[s]) {
                if (!(lag >= 0)) {
                    throw new IllegalArgumentException("Лаг должен быть неотрицательным: " + lag
                            + " (станция " + this.stations.get(s) + ")");
                }
            }
            this.lags[s] = lags[s].clone();
        }
    }

    public List<String> stations() { return stations; }

    public List<GridNode> nodes() { return nodes; }

    public int stationCount() { return stations.size(); }

    public int nodeCount() { return nodes.size(); }

    public double lag(int station, int node) { return lags[station][node]; }

    /**
     * Вектор лагов одного узла по всем станциям (порядок станций сетки).
     * @param node индекс узла
     * @return новый массив длиной {@link #stationCount()}
     */
    public double[] lagsOfNode(int node) {
        double[] out = new double[lags.length];
        for (int s = 0; s < lags.length; ++s) out[s] = lags[s][node];
        return out;
    }

    /**
     * Строка лагов станции по всем узлам.
     * @param station индекс станции
     * @return копия строки
     */
    public double[] lagsOfStation(int station) {
        return lags[station].clone();
    }

    /**
     * Новая сетка только с перечисленными узлами (в переданном порядке).
     * Строки всех станций режутся одинаково, поэтому выравнивание сохраняется.
     * @param keptNodes индексы оставляемых узлов
     */
    public LagGrid selectNodes(int[] keptNodes) {
        GridNode[] newNodes = new GridNode[keptNodes.length];
        double[][] newLags = new double[lags.length][keptNodes.length];

        for (int k = 0; k < keptNodes.length; ++k) {
            newNodes[k] = nodes.get(keptNodes[k]);
            for (int s = 0; s < lags.length; ++s) {
                newLags[s][k] = lags[s][keptNodes[k]];
            }
        }
        return new LagGrid(stations, List.of(newNodes), newLags);
    }

    @Override public String toString() {
        return "LagGrid[" + stations.size() + " stations x " + nodes.size() + " nodes]";
    }
}

package org.brightlights.utils.dataonly;

/**
 * Кумулятивный отклик сети (CNR): поэлементный максимум энергий всех узлов
 * и, для каждого сэмпла, индекс узла, давшего этот максимум.
 * @param values значения отклика
 * @param owners индексы узлов-владельцев (той же длины)
 */
public record CumulativeResponse(double[] values, int[] owners) {

    public CumulativeResponse {
        if (values.length != owners.length) {
            throw new IllegalArgumentException("CNR: " + values.length
                    + " значений и " + owners.length + " владельцев");
        }
    }

    public int length() { return values.length; }
}

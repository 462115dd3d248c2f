package org.brightlights.utils.dataonly;

/**
 * Рекорд-узел трёхмерной сетки поиска: предполагаемая точка источника.
 * <br>Порядок узлов в сетке значим — по индексу узла связаны все массивы пайплайна.</br>
 * @param latitude широта (градусы)
 * @param longitude долгота (градусы)
 * @param depth глубина (км)
 */
public record GridNode(double latitude, double longitude, double depth) {

    /**
     * Составной ключ узла вида {@code lat_lon_depth}, которым детекция
     * ссылается на узел-источник.
     * @return строковый ключ
     */
    public String key() {
        return latitude + "_" + longitude + "_" + depth;
    }

    @Override public String toString() {
        return String.format("(%.4f, %.4f, %.2f km)", latitude, longitude, depth);
    }
}

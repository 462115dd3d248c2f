package org.brightlights.utils.dataonly;

import java.util.List;

/**
 * Рекорд одной детекции в кумулятивном отклике сети.
 * @param nodeKey составной ключ узла-источника ({@link GridNode#key()})
 * @param nodeIndex индекс узла в сетке, по которой считался отклик
 * @param detectTime время детекции в секундах от начала окна анализа
 * @param stationCount сколько станций реально участвовало
 * @param peakValue значение отклика в пике
 * @param threshold использованный порог
 * @param method тег метода детекции
 * @param stations имена участвовавших станций
 */
public record Detection(String nodeKey,
                        int nodeIndex,
                        double detectTime,
                        int stationCount,
                        double peakValue,
                        double threshold,
                        String method,
                        List<String> stations) {

    public static final String BRIGHTNESS = "brightness";

    public Detection {
        stations = List.copyOf(stations);
    }
}

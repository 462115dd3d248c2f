package org.brightlights.utils.dataonly;

import java.util.List;
import java.util.Set;

/**
 * Итог одного прогона: принятые шаблоны и множество различных узлов-источников.
 * @param detections все детекции, найденные в отклике (до фильтра когерентности)
 * @param templates шаблоны, прошедшие фильтр когерентности
 * @param nodes различные узлы принятых шаблонов
 */
public record BrightnessResult(List<Detection> detections,
                               List<AcceptedTemplate> templates,
                               Set<GridNode> nodes) {

    public BrightnessResult {
        detections = List.copyOf(detections);
        templates = List.copyOf(templates);
        nodes = Set.copyOf(nodes);
    }
}

package org.brightlights.utils.dataonly;

import java.util.List;

/**
 * Кандидат в шаблон: окна всех каналов вокруг детекции.
 * @param node узел-источник
 * @param detection детекция, из которой вырезано окно
 * @param channels вырезанные окна каналов
 */
public record TemplateWindow(GridNode node, Detection detection, List<Waveform> channels) {

    public TemplateWindow {
        channels = List.copyOf(channels);
    }
}

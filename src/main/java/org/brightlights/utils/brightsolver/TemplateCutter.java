package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.dataonly.Detection;
import org.brightlights.utils.dataonly.LagGrid;
import org.brightlights.utils.dataonly.TemplateWindow;
import org.brightlights.utils.dataonly.Waveform;

import java.util.ArrayList;
import java.util.List;

/**
 * Вырезает окно шаблона вокруг детекции: все каналы всех станций сетки,
 * каждый со своим временем вступления {@code T + lag[s][node]}.
 */
public class TemplateCutter {

    private final double templateLength;
    private final double prePick;

    public TemplateCutter(BrightnessConfig config) {
        this(config.templateLength(), config.templatePrePick());
    }

    public TemplateCutter(double templateLength, double prePick) {
        this.templateLength = templateLength;
        this.prePick = prePick;
    }

    /**
     * @param grid сетка, по которой найдена детекция
     * @param detection детекция (индекс узла — в этой же сетке)
     * @param waveforms записи окна анализа
     * @return окно шаблона; окна каналов обрезаны по границам данных
     */
    public TemplateWindow cut(LagGrid grid, Detection detection, List<Waveform> waveforms) {
        int node = detection.nodeIndex();
        List<Waveform> channels = new ArrayList<>();

        for (int s = 0; s < grid.stationCount(); ++s) {
            String station = grid.stations().get(s);
            double pick = detection.detectTime() + grid.lag(s, node);

            for (Waveform w : waveforms) {
                if (!station.equals(w.station())) continue;

                int from = (int) Math.round((pick - prePick) * w.samplingRate());
                int count = (int) Math.round(templateLength * w.samplingRate());
                channels.add(w.slice(from, count));
            }
        }

        return new TemplateWindow(grid.nodes().get(node), detection, channels);
    }
}

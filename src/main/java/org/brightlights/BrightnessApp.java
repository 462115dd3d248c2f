package org.brightlights;

import org.brightlights.utils.BrightnessApplicationException;
import org.brightlights.utils.BrightnessConfig;
import org.brightlights.utils.brightsolver.CoherenceFilter;
import org.brightlights.utils.brightsolver.DetectionPicker;
import org.brightlights.utils.brightsolver.EnergyStacker;
import org.brightlights.utils.brightsolver.NodeWorkerPool;
import org.brightlights.utils.brightsolver.ResponseAggregator;
import org.brightlights.utils.brightsolver.TemplateCutter;
import org.brightlights.utils.dataonly.*;
import org.brightlights.utils.gridstore.BoundaryPolygon;
import org.brightlights.utils.gridstore.GridStore;
import org.brightlights.utils.gridstore.TravelTimeGridReader;
import org.brightlights.utils.incoming.MSeedWaveformReader;
import org.brightlights.utils.outing.NetworkResponseTXTWriter;
import org.brightlights.utils.scratch.FileScratchStore;
import org.brightlights.utils.scratch.ScratchSlot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

/**
 * Детектор «яркости» сети: поиск источников по сумме сдвинутых огибающих энергии
 * всех станций для каждого узла сетки.
 * Работа идёт в несколько фаз:
 * <ul>
 *     <li> 1. <b>Фаза I: подготовка сетки.</b>
 *     <p>
 *         Сетка лагов читается из файлов времён пробега, при необходимости
 *         режется по объёму и чистится от узлов с похожим moveout.
 *     </p>
 *     <li> 2. <b>Фаза II: яркость.</b>
 *     <p>
 *         Энергия каждого узла считается в общем пуле воркеров, затем сворачивается
 *         в кумулятивный отклик сети (в памяти или через scratch-хранилище).
 *     </p>
 *     <li> 3. <b>Фаза III: детекции и шаблоны.</b>
 *     <p>
 *         Пики отклика становятся детекциями, вокруг каждой вырезается шаблон;
 *         когерентные шаблоны рассылаются наблюдателям.
 *     </p>
 * </ul>
 * @apiNote Приложение логирует действия ИСКЛЮЧИТЕЛЬНО в консоль.
 */
public class BrightnessApp implements TemplateSubject {
/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок с:                                                                      │
    │  * Конфигурацией и компонентами пайплайна.                                   │
    │  * Наблюдателями принятых шаблонов.                                          │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    private final BrightnessConfig config;

    private final EnergyStacker stacker;
    private final ResponseAggregator aggregator = new ResponseAggregator();
    private final DetectionPicker picker;
    private final TemplateCutter cutter;
    private final CoherenceFilter coherenceFilter;

    private final List<TemplateObserver> observers = new ArrayList<>();

    public BrightnessApp(BrightnessConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.stacker = new EnergyStacker(config);
        this.picker = new DetectionPicker(config);
        this.cutter = new TemplateCutter(config);
        this.coherenceFilter = new CoherenceFilter(config);
    }

    @Override public void attach(TemplateObserver o) {
        observers.add(o);
        System.out.println("[✅] New observer (" + o.getClass().getSimpleName() + ") subscribed!");
    }

    @Override public void detach(TemplateObserver o) {
        observers.remove(o);
        System.out.println("[❌] Observer " + o.getClass().getSimpleName() + " unsubscribed");
    }

    @Override public void notifyObservers(AcceptedTemplate accepted) {
        for (TemplateObserver obs : observers) {
            obs.update(accepted);
        }
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Полный прогон по файлам                                                      │
    │       - run(Path, Path): miniSEED + времена пробега -> результат.            │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    /**
     * Прогон по директориям с файлами.
     * @param gridDirectory директория с файлами времён пробега
     * @param waveformDirectory директория с {@code .mseed}
     * @return принятые шаблоны и их узлы
     * @throws IOException ошибка чтения входных файлов или scratch-хранилища
     */
    public BrightnessResult run(Path gridDirectory, Path waveformDirectory) throws IOException {
        System.out.println("————————————————————————————————————————————————————————");
        System.out.println("⚡️ ЗАПУСК детектора яркости (instance " + config.instance() + ") ⚡️");
        System.out.println("————————————————————————————————————————————————————————");

        System.out.println("\n==---( [Step 1/4] ЧТЕНИЕ miniSEED )---==");
        List<Waveform> waveforms = Waveform.trimToCommonWindow(
                new MSeedWaveformReader(waveformDirectory).readAll());

        List<String> stations = config.stations().isEmpty()
                ? stationsOf(waveforms)
                : config.stations();

        System.out.println("\n==---( [Step 2/4] ЧТЕНИЕ СЕТКИ ЛАГОВ )---==");
        LagGrid grid = new TravelTimeGridReader(gridDirectory, config.phase(), config.phaseOut(), config.psRatio())
                .read(stations);

        return brightness(grid, waveforms);
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Фаза I: подготовка сетки                                                     │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    /**
     * Ресэмплинг и дедупликация сетки, если они заданы конфигурацией.
     */
    public LagGrid prepareGrid(LagGrid grid) {
        LagGrid out = grid;

        BrightnessConfig.ResampleVolume volume = config.resample();
        if (volume != null) {
            out = GridStore.resample(out, volume.minDepth(), volume.maxDepth(),
                    BoundaryPolygon.fromWkt(volume.boundaryWkt()));
        }
        if (config.nodeDedupThreshold() != null) {
            out = GridStore.deduplicate(out, config.nodeDedupThreshold());
        }
        return out;
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Фазы II и III: яркость, детекции, шаблоны                                    │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    /**
     * Ядро детектора.
     * @param rawGrid сетка лагов (до ресэмплинга и дедупликации)
     * @param rawWaveforms записи с общей частотой и длиной
     * @return принятые шаблоны и различные узлы
     * @throws IOException ошибка scratch-хранилища или выходных файлов
     * @throws IllegalArgumentException если записи не согласованы по частоте или длине
     */
    public BrightnessResult brightness(LagGrid rawGrid, List<Waveform> rawWaveforms) throws IOException {
        LagGrid grid = prepareGrid(rawGrid);
        if (grid.nodeCount() == 0) {
            throw new BrightnessApplicationException("Сетка пуста после ресэмплинга: искать негде");
        }
        List<Waveform> waveforms = withPrecision(rawWaveforms);
        double fs = validateWindow(waveforms);

        List<String> realStations = new ArrayList<>();
        Set<String> present = new HashSet<>(stationsOf(waveforms));
        for (String st : grid.stations()) {
            if (present.contains(st)) realStations.add(st);
        }
        if (realStations.isEmpty()) {
            System.err.println("[⚠] None of the grid stations has data, the response will be zero");
        }

        System.out.println("\n==---( [Step 3/4] ЯРКОСТЬ: " + grid.nodeCount() + " узлов, "
                + realStations.size() + " станций )---==");

        CumulativeResponse cnr;
        try (NodeWorkerPool pool = new NodeWorkerPool(config.cores(), grid.nodeCount())) {
            System.out.println("[i] Worker pool of " + pool.size() + " threads");
            cnr = config.outOfCore()
                    ? stackOutOfCore(grid, waveforms, pool)
                    : stackInMemory(grid, waveforms, pool);
        }

        if (config.writeNetworkResponse()) {
            new NetworkResponseTXTWriter(config.outputDirectory()).save(cnr, fs);
        }

        System.out.println("\n==---( [Step 4/4] ДЕТЕКЦИИ И ШАБЛОНЫ )---==");
        List<Detection> detections = picker.findDetections(cnr, grid.nodes(), fs, realStations);

        List<AcceptedTemplate> templates = new ArrayList<>();
        Set<GridNode> nodes = new LinkedHashSet<>();
        for (Detection detection : detections) {
            TemplateWindow window = cutter.cut(grid, detection, waveforms);

            Optional<AcceptedTemplate> accepted = coherenceFilter.accept(window);
            if (accepted.isEmpty()) continue;

            templates.add(accepted.get());
            nodes.add(accepted.get().node());
            notifyObservers(accepted.get());
        }

        System.out.println("[✅] " + templates.size() + " of " + detections.size()
                + " detections became templates (" + nodes.size() + " distinct nodes)");
        return new BrightnessResult(detections, templates, nodes);
    }

    private CumulativeResponse stackInMemory(LagGrid grid, List<Waveform> waveforms, NodeWorkerPool pool) {
        List<Callable<double[]>> tasks = new ArrayList<>(grid.nodeCount());
        for (int node = 0; node < grid.nodeCount(); ++node) {
            final int i = node;
            tasks.add(() -> stacker.stackNode(grid, i, waveforms));
        }

        List<double[]> traces = pool.runAll(tasks);
        return aggregator.reduce(traces.toArray(new double[0][]));
    }

    private CumulativeResponse stackOutOfCore(LagGrid grid, List<Waveform> waveforms, NodeWorkerPool pool)
            throws IOException {
        try (FileScratchStore store = new FileScratchStore(config.scratchDirectory(), config.instance())) {
            System.out.println("[i] Scratch directory: " + store.correctPath().toAbsolutePath());

            List<Callable<ScratchSlot>> tasks = new ArrayList<>(grid.nodeCount());
            for (int node = 0; node < grid.nodeCount(); ++node) {
                final int i = node;
                tasks.add(() -> store.write(i, stacker.stackNode(grid, i, waveforms)));
            }

            List<ScratchSlot> slots = pool.runAll(tasks);
            System.out.println("[i] " + slots.size() + " energy traces written to scratch");

            return aggregator.reduce(store, grid.nodeCount(), pool);
        }
    }

    private List<Waveform> withPrecision(List<Waveform> waveforms) {
        if (config.samplePrecision() == SamplePrecision.DOUBLE) return waveforms;

        List<Waveform> out = new ArrayList<>(waveforms.size());
        for (Waveform w : waveforms) {
            out.add(w.withSamples(config.samplePrecision().apply(w.samples()), w.startTime()));
        }
        return out;
    }

    /**
     * Все записи должны иметь общую частоту и длину окна.
     * @return общая частота дискретизации
     */
    static double validateWindow(List<Waveform> waveforms) {
        if (waveforms.isEmpty()) {
            throw new IllegalArgumentException("Нет ни одной записи для анализа");
        }

        Waveform head = waveforms.get(0);
        for (Waveform w : waveforms) {
            if (Math.abs(w.samplingRate() - head.samplingRate()) > 1e-9) {
                throw new IllegalArgumentException("Разные частоты дискретизации: "
                        + head.id() + " (" + head.samplingRate() + " Hz) и "
                        + w.id() + " (" + w.samplingRate() + " Hz)");
            }
            if (w.length() != head.length()) {
                throw new IllegalArgumentException("Разная длина окна: "
                        + head.id() + " (" + head.length() + ") и "
                        + w.id() + " (" + w.length() + ")");
            }
        }
        return head.samplingRate();
    }

    private static List<String> stationsOf(List<Waveform> waveforms) {
        Set<String> names = new TreeSet<>();
        for (Waveform w : waveforms) names.add(w.station());
        return new ArrayList<>(names);
    }
}

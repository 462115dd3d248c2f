package org.brightlights.utils.brightsolver;

import org.brightlights.utils.BrightnessApplicationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Пул воркеров фиксированного размера, общий для двух фаз:
 * расчёта энергий (задача на узел) и свёртки отклика (задача на диапазон узлов).
 * <p>
 *     Размер — минимум из бюджета ядер, доступных процессоров и числа узлов:
 *     воркеров никогда не больше, чем единиц работы.
 * </p>
 * Единственная точка синхронизации — {@link #runAll(List)}: она дожидается всех задач фазы.
 * Таймаутов и отмены нет: зависшая задача подвешивает весь прогон.
 */
public class NodeWorkerPool implements AutoCloseable {

    private final int size;
    private final ExecutorService executor;

    public NodeWorkerPool(int coreBudget, int nodeCount) {
        this.size = poolSize(coreBudget, Runtime.getRuntime().availableProcessors(), nodeCount);
        this.executor = Executors.newFixedThreadPool(size);
    }

    /**
     * Размер пула: {@code min(cores, cpus, nodes)}, но не меньше единицы.
     */
    public static int poolSize(int coreBudget, int availableProcessors, int nodeCount) {
        return Math.max(1, Math.min(coreBudget, Math.min(availableProcessors, nodeCount)));
    }

    public int size() {
        return size;
    }

    /**
     * Запускает все задачи фазы и ждёт их завершения.
     * <br>Любая упавшая задача обрывает прогон целиком: пропущенный узел незаметно
     * испортил бы глобальный максимум отклика.</br>
     * @param tasks задачи фазы
     * @return результаты в порядке задач
     * @throws BrightnessApplicationException если хотя бы одна задача упала
     */
    public <T> List<T> runAll(List<? extends Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(executor.submit(task));
        }

        List<T> results = new ArrayList<>(tasks.size());
        try {
            for (int i = 0; i < futures.size(); ++i) {
                results.add(futures.get(i).get());
            }
        } catch (ExecutionException ee) {
            cancelAll(futures);
            throw new BrightnessApplicationException("Worker task failed: " + ee.getCause(), ee.getCause());
        } catch (InterruptedException ie) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new BrightnessApplicationException("Interrupted while waiting for workers", ie);
        }
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) f.cancel(true);
    }

    @Override public void close() {
        executor.shutdownNow();
    }
}

package org.brightlights.utils.scratch;

import java.io.IOException;

/**
 * Хранилище энергий узлов для режима «не в памяти».
 * <p>
 *     Слоты адресуются парой (прогон, индекс узла). Каждая задача пула пишет только
 *     в свои индексы, поэтому блокировки не нужны.
 * </p>
 */
public interface ScratchStore {

    /**
     * Идентификатор прогона, которому принадлежат слоты.
     */
    String instance();

    /**
     * Сохранить энергию узла.
     * @return ссылка на записанный слот
     */
    ScratchSlot write(int nodeIndex, double[] trace) throws IOException;

    /**
     * Прочитать энергию узла.
     */
    double[] read(ScratchSlot slot) throws IOException;

    /**
     * Удалить слот сразу после использования (ограничивает пиковый объём на диске).
     */
    void delete(ScratchSlot slot) throws IOException;

    /**
     * Ссылка на слот узла этого прогона (без проверки существования).
     */
    default ScratchSlot slotOf(int nodeIndex) {
        return new ScratchSlot(instance(), nodeIndex);
    }
}

package org.brightlights.utils.scratch;

/**
 * Ссылка на слот scratch-хранилища: энергия одного узла одного прогона.
 * @param instance идентификатор прогона
 * @param nodeIndex индекс узла
 */
public record ScratchSlot(String instance, int nodeIndex) {

    @Override public String toString() {
        return "tmp" + instance + "/node_" + nodeIndex;
    }
}

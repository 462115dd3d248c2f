package org.brightlights.utils;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Интерфейс, маркирующий реализующие классы как "пишут в файлы"
 * или "читают файлы и взаимодействуют с ними" (сетка лагов, miniSEED, scratch, отчёты).
 */
public interface Fileable {

    /**
     * Каждый реализующий класс отчитывается корректной директорией,
     * откуда читает или куда пишет файлы.
     * @return готовый путь
     */
    Path correctPath();

    /**
     * Дата сегодняшнего дня в виде {@code yyyy-mm-dd} (для имён выходных файлов).
     * @return строка с датой
     */
    static String formattedToday() {
        LocalDateTime today = LocalDateTime.now();
        return String.format("%04d-%02d-%02d",
                today.getYear(),
                today.getMonthValue(),
                today.getDayOfMonth());
    }
}

package org.brightlights.utils;

/**
 * Фатальная ошибка прогона: конфигурация, сетка лагов или упавшая задача пула.
 * Прогон останавливается целиком, частичного результата не бывает.
 */
public class BrightnessApplicationException extends RuntimeException {

    public BrightnessApplicationException(String message) {
        super(message);
    }

    public BrightnessApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.brightlights.utils.dataonly;

/**
 * Способ вычисления порога детекции по кумулятивному отклику.
 */
public enum ThresholdMode {
    /** median(|cnr|) * множитель */
    MAD,
    /** множитель используется как абсолютный порог */
    ABS,
    /** sqrt(mean(cnr^2)) * множитель */
    RMS;

    /**
     * Разбор значения из конфигурации. Понимает и {@code "abs"} в любом регистре.
     */
    public static ThresholdMode parse(String raw) {
        return switch (raw.trim().toUpperCase()) {
            case "MAD" -> MAD;
            case "ABS" -> ABS;
            case "RMS" -> RMS;
            default -> throw new IllegalArgumentException("Неизвестный режим порога: " + raw);
        };
    }
}

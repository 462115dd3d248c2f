package org.brightlights.utils.dataonly;

/**
 * Точность отсчётов перед расчётом энергии.
 * <br>{@code FLOAT} — осознанный размен точности на память: каждый отсчёт
 * проходит через 32-битный {@code float}.</br>
 */
public enum SamplePrecision {
    DOUBLE,
    FLOAT;

    public double[] apply(double[] samples) {
        if (this == DOUBLE) return samples;

        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; ++i) out[i] = (float) samples[i];
        return out;
    }
}

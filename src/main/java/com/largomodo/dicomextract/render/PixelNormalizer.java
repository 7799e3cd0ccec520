package com.largomodo.dicomextract.render;

/**
 * Linear min-max stretch of modality values to the 8-bit display range.
 * <p>
 * A constant image (max == min) maps to black rather than dividing by zero.
 */
final class PixelNormalizer {

    private PixelNormalizer() {
    }

    static byte[] stretch(double[] samples, boolean invert) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double sample : samples) {
            if (sample < min) {
                min = sample;
            }
            if (sample > max) {
                max = sample;
            }
        }

        byte[] out = new byte[samples.length];
        double range = max - min;
        for (int i = 0; i < samples.length; i++) {
            int value = range > 0 ? (int) Math.round((samples[i] - min) * 255.0 / range) : 0;
            if (invert) {
                value = 255 - value;
            }
            out[i] = (byte) value;
        }
        return out;
    }
}

package com.ttennebkram.texturefix.mask;

import java.util.Arrays;

/**
 * Percentile with linear interpolation between closest ranks.
 */
final class Percentile {

    private Percentile() {
    }

    /**
     * @param values     sample values (not modified)
     * @param percentile 0..100; values outside are clamped to the min/max sample
     */
    static double of(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("invalid input shape: no values");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double position = percentile / 100.0 * (sorted.length - 1);
        if (position <= 0) {
            return sorted[0];
        }
        if (position >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        int lower = (int) Math.floor(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[lower + 1] - sorted[lower]) * fraction;
    }
}

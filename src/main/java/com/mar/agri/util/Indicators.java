package com.mar.agri.util;

import java.util.Arrays;

/**
 * Trailing series transforms. Positions without enough history hold {@code NaN}.
 */
public class Indicators {

    /** Value {@code k} steps back: {@code out[i] = series[i - k]}. */
    public static double[] lag(double[] series, int k) {
        double[] out = new double[series.length];
        Arrays.fill(out, Double.NaN);
        for (int i = k; i < series.length; i++) {
            out[i] = series[i - k];
        }
        return out;
    }

    /**
     * Mean over the trailing {@code window} values including position i.
     * The window narrows at the start of the series, so every position is defined.
     */
    public static double[] rollingMean(double[] series, int window) {
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            int from = Math.max(0, i - window + 1);
            double sum = 0.0;
            for (int j = from; j <= i; j++) sum += series[j];
            out[i] = sum / (i - from + 1);
        }
        return out;
    }

    /**
     * Sample standard deviation (n - 1 denominator) over the trailing {@code window} values.
     * Narrows at the start like {@link #rollingMean}; a single-value window is {@code NaN}.
     */
    public static double[] rollingStd(double[] series, int window) {
        double[] out = new double[series.length];
        Arrays.fill(out, Double.NaN);
        for (int i = 1; i < series.length; i++) {
            int from = Math.max(0, i - window + 1);
            int n = i - from + 1;
            if (n < 2) continue;
            double sum = 0.0;
            for (int j = from; j <= i; j++) sum += series[j];
            double mean = sum / n;
            double ss = 0.0;
            for (int j = from; j <= i; j++) ss += (series[j] - mean) * (series[j] - mean);
            out[i] = Math.sqrt(ss / (n - 1));
        }
        return out;
    }
}

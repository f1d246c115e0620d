package com.mar.agri.domain.model;

import java.util.Arrays;

/**
 * Per-feature mean and standard deviation fitted on one training partition.
 * A zero standard deviation is stored as a scale of 1 so constant features map to 0.
 */
public record ScalingParameters(double[] means, double[] scales) {

    public ScalingParameters {
        if (means.length != scales.length) {
            throw new IllegalArgumentException("means and scales differ in length: " + means.length + " vs " + scales.length);
        }
        means = means.clone();
        scales = scales.clone();
    }

    public double[] transform(double[] vector) {
        if (vector.length != means.length) {
            throw new IllegalArgumentException("expected " + means.length + " features, got " + vector.length);
        }
        double[] out = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (vector[i] - means[i]) / scales[i];
        }
        return out;
    }

    @Override
    public double[] means() {
        return means.clone();
    }

    @Override
    public double[] scales() {
        return scales.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalingParameters other)) return false;
        return Arrays.equals(means, other.means) && Arrays.equals(scales, other.scales);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(means) + Arrays.hashCode(scales);
    }

    @Override
    public String toString() {
        return "ScalingParameters{means=" + Arrays.toString(means) + ", scales=" + Arrays.toString(scales) + "}";
    }
}

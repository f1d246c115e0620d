package com.mar.agri.service;

import java.util.List;
import org.springframework.stereotype.Service;
import com.mar.agri.domain.model.ScalingParameters;
import com.mar.agri.util.FeatureStats;

/**
 * Standardizes feature vectors. Holds no state: {@link #fit} returns the parameters and callers
 * keep them for the lifetime of one forecast.
 */
@Service
public class FeatureScaler {

    private static final double EPS = 1e-12;

    public ScalingParameters fit(List<double[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("cannot fit scaling parameters on zero vectors");
        }
        int dim = vectors.get(0).length;
        double[] means = new double[dim];
        double[] scales = new double[dim];
        for (int f = 0; f < dim; f++) {
            final int idx = f;
            double[] column = vectors.stream().mapToDouble(v -> v[idx]).toArray();
            means[f] = FeatureStats.mean(column);
            double std = FeatureStats.std(column);
            scales[f] = std < EPS ? 1.0 : std;
        }
        return new ScalingParameters(means, scales);
    }

    public List<double[]> transform(ScalingParameters params, List<double[]> vectors) {
        return vectors.stream().map(params::transform).toList();
    }
}

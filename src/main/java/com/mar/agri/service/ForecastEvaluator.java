package com.mar.agri.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.model.ConfidenceInterval;
import com.mar.agri.domain.model.ModelMetrics;
import com.mar.agri.util.FeatureStats;

@Service
@RequiredArgsConstructor
public class ForecastEvaluator {

    static final double EPS = 1e-9;

    private final AppProperties props;

    /**
     * Holdout MAE, R² and an accuracy score in [0, 100].
     *
     * R² over a constant holdout is 1 when every prediction is exact and 0 otherwise.
     * Accuracy is 0 when the holdout mean price is (near) zero.
     */
    public ModelMetrics evaluate(double[] actual, double[] predicted) {
        if (actual.length != predicted.length || actual.length == 0) {
            throw new IllegalArgumentException("need equal, non-empty actual/predicted arrays: "
                + actual.length + " vs " + predicted.length);
        }
        int n = actual.length;
        double absErr = 0.0;
        double ssRes = 0.0;
        for (int i = 0; i < n; i++) {
            double e = actual[i] - predicted[i];
            absErr += Math.abs(e);
            ssRes += e * e;
        }
        double mae = absErr / n;

        double mean = FeatureStats.mean(actual);
        double ssTot = 0.0;
        for (double a : actual) ssTot += (a - mean) * (a - mean);

        double r2;
        if (ssTot < EPS) {
            r2 = ssRes < EPS ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - ssRes / ssTot;
        }

        double accuracy = Math.abs(mean) < EPS ? 0.0 : clamp((1.0 - mae / mean) * 100.0, 0.0, 100.0);
        return new ModelMetrics(mae, r2, accuracy);
    }

    public ConfidenceInterval interval(double predicted, double mae) {
        double halfWidth = mae * props.getForecast().getConfidenceMultiplier();
        return new ConfidenceInterval(Math.max(0.0, predicted - halfWidth), predicted + halfWidth);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

package com.mar.agri.service.regression;

import java.util.List;

/**
 * The forest and boosted models of one invocation. Predictions are their unweighted mean.
 */
public record RegressorPair(FittedRegressor forest, FittedRegressor boosting) {

    public double predict(double[] scaledFeatures) {
        return (forest.predict(scaledFeatures) + boosting.predict(scaledFeatures)) / 2.0;
    }

    public double[] predictAll(List<double[]> scaledRows) {
        double[] out = new double[scaledRows.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = predict(scaledRows.get(i));
        }
        return out;
    }
}

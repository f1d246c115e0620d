package com.mar.agri.service.regression;

/**
 * A trained price model that maps one scaled feature vector to a price.
 */
public interface FittedRegressor {

    RegressorKind kind();

    double predict(double[] scaledFeatures);
}

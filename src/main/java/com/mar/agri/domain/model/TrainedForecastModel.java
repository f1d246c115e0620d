package com.mar.agri.domain.model;

import com.mar.agri.service.regression.RegressorPair;

/**
 * The regressor pair and scaling parameters produced by a single pipeline invocation,
 * along with the holdout metrics and partition sizes measured when it was fitted.
 */
public record TrainedForecastModel(
    ScalingParameters scaling,
    RegressorPair regressors,
    ModelMetrics metrics,
    int trainingSamples,
    int testSamples
) {}

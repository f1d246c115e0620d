package com.mar.agri.service.regression;

import org.tribuo.Model;
import org.tribuo.regression.Regressor;
import com.mar.agri.util.TribuoUtil;

/**
 * Bagged randomized CART trees, averaged by Tribuo's ensemble model.
 */
public record ForestRegressor(Model<Regressor> model) implements FittedRegressor {

    @Override
    public RegressorKind kind() {
        return RegressorKind.RANDOM_FOREST;
    }

    @Override
    public double predict(double[] scaledFeatures) {
        return TribuoUtil.predict(model, scaledFeatures);
    }
}

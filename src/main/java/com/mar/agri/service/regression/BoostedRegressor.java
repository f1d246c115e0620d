package com.mar.agri.service.regression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.tribuo.Model;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.rtree.CARTRegressionTrainer;
import com.mar.agri.domain.model.Boosting;
import com.mar.agri.util.FeatureStats;
import com.mar.agri.util.TribuoUtil;

/**
 * Least-squares gradient boosting over Tribuo CART trees.
 *
 * Starts from the mean target; every stage fits a shallow tree to the residuals of the
 * ensemble so far and is added with weight {@code learningRate}.
 */
public record BoostedRegressor(double baseline, double learningRate, List<Model<Regressor>> stages) implements FittedRegressor {

    public BoostedRegressor {
        stages = List.copyOf(stages);
    }

    static BoostedRegressor fit(List<double[]> scaled, double[] targets, Boosting cfg) {
        if (scaled.isEmpty()) {
            throw new IllegalArgumentException("cannot boost on an empty training set");
        }
        double baseline = FeatureStats.mean(targets);
        double[] current = new double[targets.length];
        Arrays.fill(current, baseline);

        CARTRegressionTrainer trainer = RegressorKind.cart(cfg.getMaxDepth(), 1.0f, cfg.getSeed());
        List<Model<Regressor>> stages = new ArrayList<>(cfg.getStages());
        double[] residual = new double[targets.length];

        for (int m = 0; m < cfg.getStages(); m++) {
            for (int i = 0; i < targets.length; i++) {
                residual[i] = targets[i] - current[i];
            }
            Model<Regressor> tree = trainer.train(TribuoUtil.dataset(scaled, residual, "boost-stage-" + m));
            for (int i = 0; i < targets.length; i++) {
                current[i] += cfg.getLearningRate() * TribuoUtil.predict(tree, scaled.get(i));
            }
            stages.add(tree);
        }
        return new BoostedRegressor(baseline, cfg.getLearningRate(), stages);
    }

    @Override
    public RegressorKind kind() {
        return RegressorKind.GRADIENT_BOOSTING;
    }

    @Override
    public double predict(double[] scaledFeatures) {
        double y = baseline;
        for (Model<Regressor> stage : stages) {
            y += learningRate * TribuoUtil.predict(stage, scaledFeatures);
        }
        return y;
    }
}

package com.mar.agri.service.regression;

import java.util.List;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.common.tree.RandomForestTrainer;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.ensemble.AveragingCombiner;
import org.tribuo.regression.rtree.CARTRegressionTrainer;
import org.tribuo.regression.rtree.impurity.MeanSquaredError;
import com.mar.agri.domain.model.Boosting;
import com.mar.agri.domain.model.Forest;
import com.mar.agri.util.TribuoUtil;

/**
 * The two tree learners making up the forecast ensemble.
 *
 * Each call to {@code fit} builds fresh Tribuo trainers: they keep RNG state between
 * invocations, so sharing one across forecasts would make results order dependent.
 */
public enum RegressorKind {

    RANDOM_FOREST {
        @Override
        public FittedRegressor fit(List<double[]> scaled, double[] targets, Forest forest, Boosting boosting) {
            var tree = cart(forest.getMaxDepth(), forest.getFeatureFraction(), forest.getSeed());
            var trainer = new RandomForestTrainer<>(tree, new AveragingCombiner(), forest.getTrees(), forest.getSeed());
            MutableDataset<Regressor> train = TribuoUtil.dataset(scaled, targets, "forest-train");
            Model<Regressor> model = trainer.train(train);
            return new ForestRegressor(model);
        }
    },

    GRADIENT_BOOSTING {
        @Override
        public FittedRegressor fit(List<double[]> scaled, double[] targets, Forest forest, Boosting boosting) {
            return BoostedRegressor.fit(scaled, targets, boosting);
        }
    };

    // leaves may hold a single example, matching the usual CART defaults for small series
    static final float MIN_CHILD_WEIGHT = 1.0f;

    public abstract FittedRegressor fit(List<double[]> scaled, double[] targets, Forest forest, Boosting boosting);

    static CARTRegressionTrainer cart(int maxDepth, float featureFraction, long seed) {
        return new CARTRegressionTrainer(maxDepth, MIN_CHILD_WEIGHT, 0.0f, featureFraction, false, new MeanSquaredError(), seed);
    }
}

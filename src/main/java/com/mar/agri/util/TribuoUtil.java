package com.mar.agri.util;

import java.util.ArrayList;
import java.util.List;
import org.tribuo.Example;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.datasource.ListDataSource;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import com.mar.agri.domain.model.FeatureRow;

public class TribuoUtil {

    public static final String TARGET = "price";

    private static final RegressionFactory FACTORY = new RegressionFactory();
    private static final String[] FEATURE_NAMES = FeatureRow.FEATURE_NAMES.toArray(new String[0]);

    public static Example<Regressor> example(double[] scaled, double target) {
        return new ArrayExample<>(new Regressor(TARGET, target), FEATURE_NAMES, scaled);
    }

    /** Example for inference; the output is Tribuo's unknown placeholder. */
    public static Example<Regressor> unlabelled(double[] scaled) {
        return new ArrayExample<>(RegressionFactory.UNKNOWN_REGRESSOR, FEATURE_NAMES, scaled);
    }

    public static MutableDataset<Regressor> dataset(List<double[]> scaled, double[] targets, String name) {
        if (scaled.size() != targets.length) {
            throw new IllegalArgumentException("features and targets differ in length: " + scaled.size() + " vs " + targets.length);
        }
        List<Example<Regressor>> examples = new ArrayList<>(scaled.size());
        for (int i = 0; i < scaled.size(); i++) {
            examples.add(example(scaled.get(i), targets[i]));
        }
        var source = new ListDataSource<>(examples, FACTORY, new SimpleDataSourceProvenance(name, FACTORY));
        return new MutableDataset<>(source);
    }

    public static double predict(Model<Regressor> model, double[] scaled) {
        return model.predict(unlabelled(scaled)).getOutput().getValues()[0];
    }
}

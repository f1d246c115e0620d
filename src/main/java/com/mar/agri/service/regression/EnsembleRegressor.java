package com.mar.agri.service.regression;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.util.List;
import org.springframework.stereotype.Service;
import com.mar.agri.config.AppProperties;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnsembleRegressor {

    private final AppProperties props;

    /** Trains both learners independently on the same scaled rows. */
    public RegressorPair fit(List<double[]> scaled, double[] targets) {
        long t0 = System.currentTimeMillis();
        FittedRegressor forest = RegressorKind.RANDOM_FOREST.fit(scaled, targets, props.getForest(), props.getBoosting());
        FittedRegressor boosting = RegressorKind.GRADIENT_BOOSTING.fit(scaled, targets, props.getForest(), props.getBoosting());
        log.debug("FORECAST | fitted {} and {} on {} rows in {} ms", forest.kind(), boosting.kind(),
            scaled.size(), System.currentTimeMillis() - t0);
        return new RegressorPair(forest, boosting);
    }
}

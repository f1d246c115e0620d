package com.mar.agri.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.util.List;
import org.springframework.stereotype.Service;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.InsufficientDataException;
import com.mar.agri.domain.model.ConfidenceInterval;
import com.mar.agri.domain.model.FeatureRow;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.ModelMetrics;
import com.mar.agri.domain.model.PriceForecast;
import com.mar.agri.domain.model.ScalingParameters;
import com.mar.agri.domain.model.TrainedForecastModel;
import com.mar.agri.service.regression.EnsembleRegressor;
import com.mar.agri.service.regression.RegressorPair;
import com.mar.agri.util.FeatureStats;

/**
 * Price forecasting pipeline: features, chronological split, scaling, ensemble fit,
 * holdout evaluation and a one-step-ahead prediction from the latest feature row.
 *
 * Every invocation fits its own scaling parameters and regressors; this bean holds only
 * configuration and collaborators, so concurrent calls do not share state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceForecastService {

    private static final double EPS = 1e-9;

    private final AppProperties props;
    private final FeatureBuilder featureBuilder;
    private final FeatureScaler featureScaler;
    private final DatasetSplitter datasetSplitter;
    private final EnsembleRegressor ensembleRegressor;
    private final ForecastEvaluator evaluator;

    /**
     * Trains on {@code series} (one commodity, optionally one state) and forecasts the next price.
     *
     * @param horizon days ahead requested by the caller; must be positive. The forecast is
     *                always one step past the last observation whatever the value.
     * @throws InsufficientDataException when the series or its complete feature rows fall below the minimum
     */
    public PriceForecast forecast(List<MarketObservation> series, int horizon) {
        requireHorizon(horizon);
        int minRows = props.getForecast().getMinRows();
        String label = label(series);

        if (series.size() < minRows) {
            log.info("FORECAST | {} rejected: {} observations, need {}", label, series.size(), minRows);
            throw new InsufficientDataException(minRows, series.size());
        }

        List<FeatureRow> rows = featureBuilder.build(series);
        log.info("FORECAST | {} observations={} featureRows={} horizon={}", label, series.size(), rows.size(), horizon);
        FeatureStats.logFeatureStats(rows);
        if (rows.size() < minRows) {
            log.info("FORECAST | {} rejected: {} complete feature rows, need {}", label, rows.size(), minRows);
            throw new InsufficientDataException(minRows, rows.size());
        }

        DatasetSplitter.TrainTestSplit split = datasetSplitter.split(rows, props.getForecast().getTestFraction());
        List<double[]> trainX = split.train().stream().map(FeatureRow::features).toList();
        List<double[]> testX = split.test().stream().map(FeatureRow::features).toList();

        ScalingParameters scaling = featureScaler.fit(trainX);
        RegressorPair regressors = ensembleRegressor.fit(featureScaler.transform(scaling, trainX), targets(split.train()));

        double[] holdoutPredictions = regressors.predictAll(featureScaler.transform(scaling, testX));
        ModelMetrics metrics = evaluator.evaluate(targets(split.test()), holdoutPredictions);
        log.info("FORECAST | {} train={} test={} mae={} r2={} accuracy={}", label,
            split.train().size(), split.test().size(),
            String.format("%.4f", metrics.mae()),
            String.format("%.4f", metrics.r2Score()),
            String.format("%.2f", metrics.accuracy()));

        TrainedForecastModel model = new TrainedForecastModel(scaling, regressors, metrics,
            split.train().size(), split.test().size());
        return new PriceForecast(assemble(model, rows.get(rows.size() - 1)), model);
    }

    /**
     * Forecasts from an already trained model without refitting. The reported metrics and
     * sample counts are those measured when the model was trained.
     */
    public ForecastResult predict(TrainedForecastModel model, List<MarketObservation> series) {
        List<FeatureRow> rows = featureBuilder.build(series);
        if (rows.isEmpty()) {
            throw new InsufficientDataException(1, 0);
        }
        return assemble(model, rows.get(rows.size() - 1));
    }

    private ForecastResult assemble(TrainedForecastModel model, FeatureRow latest) {
        double predicted = model.regressors().predict(model.scaling().transform(latest.features()));
        ConfidenceInterval interval = evaluator.interval(predicted, model.metrics().mae());

        double current = latest.price();
        double change = predicted - current;
        double changePercent;
        if (Math.abs(current) < EPS) {
            log.warn("FORECAST | current price is zero, reporting price change percent as 0");
            changePercent = 0.0;
        } else {
            changePercent = change / current * 100.0;
        }

        return new ForecastResult(predicted, interval, model.metrics(), current, change, changePercent,
            model.trainingSamples(), model.testSamples());
    }

    private static double[] targets(List<FeatureRow> rows) {
        return rows.stream().mapToDouble(FeatureRow::price).toArray();
    }

    private static void requireHorizon(int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be a positive number of days, got " + horizon);
        }
    }

    private static String label(List<MarketObservation> series) {
        return series.isEmpty() ? "<empty>" : series.get(0).commodity();
    }
}

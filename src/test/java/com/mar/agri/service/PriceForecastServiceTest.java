package com.mar.agri.service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.InsufficientDataException;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.PriceForecast;
import com.mar.agri.service.regression.EnsembleRegressor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PriceForecastServiceTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    static PriceForecastService service(AppProperties props) {
        return new PriceForecastService(props, new FeatureBuilder(props), new FeatureScaler(),
            new DatasetSplitter(), new EnsembleRegressor(props), new ForecastEvaluator(props));
    }

    private final PriceForecastService service = service(new AppProperties());

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void forecastsAnUpwardLinearSeries() {
        ForecastResult r = service.forecast(Series.linear("Onion", 30, 100, 1), 7).result();

        assertThat(r.trainingSamples()).isEqualTo(21);
        assertThat(r.testSamples()).isEqualTo(6);
        assertThat(r.currentPrice()).isEqualTo(129.0);
        // trees cannot extrapolate past the training range, so the estimate stays near its top (123)
        assertThat(r.predictedPrice()).isBetween(118.0, 130.0);
        assertThat(r.modelMetrics().mae()).isLessThan(6.0);
        assertThat(r.modelMetrics().accuracy()).isGreaterThan(90.0);
        assertThat(r.priceChange()).isCloseTo(r.predictedPrice() - 129.0, within(1e-9));
        assertThat(r.priceChangePercent()).isCloseTo(r.priceChange() / 129.0 * 100.0, within(1e-9));
    }

    @Test
    void constantSeriesIsPredictedExactly() {
        ForecastResult r = service.forecast(Series.constant("Onion", 25, 50), 7).result();

        assertThat(r.trainingSamples()).isEqualTo(17);
        assertThat(r.testSamples()).isEqualTo(5);
        assertThat(r.predictedPrice()).isCloseTo(50.0, within(1e-6));
        assertThat(r.modelMetrics().mae()).isCloseTo(0.0, within(1e-6));
        assertThat(r.modelMetrics().r2Score()).isEqualTo(1.0);
        assertThat(r.modelMetrics().accuracy()).isCloseTo(100.0, within(1e-6));
        assertThat(r.confidenceInterval().lower()).isCloseTo(50.0, within(1e-6));
        assertThat(r.confidenceInterval().upper()).isCloseTo(50.0, within(1e-6));
    }

    @Test
    void intervalWrapsThePredictionByOneAndAHalfMae() {
        ForecastResult r = service.forecast(Series.linear("Onion", 40, 200, -2), 1).result();
        double half = r.modelMetrics().mae() * 1.5;

        assertThat(r.confidenceInterval().upper()).isCloseTo(r.predictedPrice() + half, within(1e-9));
        assertThat(r.confidenceInterval().lower()).isCloseTo(Math.max(0.0, r.predictedPrice() - half), within(1e-9));
        assertThat(r.confidenceInterval().lower()).isLessThanOrEqualTo(r.predictedPrice());
        assertThat(r.modelMetrics().accuracy()).isBetween(0.0, 100.0);
    }

    @Test
    void rejectsTenObservations() {
        assertThatThrownBy(() -> service.forecast(Series.linear("Onion", 10, 100, 1), 7))
            .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                assertThat(e.getMinRequired()).isEqualTo(20);
                assertThat(e.getAvailable()).isEqualTo(10);
            });
    }

    @Test
    void rejectsWhenTooFewFeatureRowsSurvive() {
        // 22 observations leave 19 complete rows
        assertThatThrownBy(() -> service.forecast(Series.linear("Onion", 22, 100, 1), 7))
            .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                assertThat(e.getMinRequired()).isEqualTo(20);
                assertThat(e.getAvailable()).isEqualTo(19);
            });
    }

    @Test
    void rejectsNonPositiveHorizon() {
        assertThatThrownBy(() -> service.forecast(Series.linear("Onion", 30, 100, 1), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void horizonDoesNotChangeTheForecast() {
        List<MarketObservation> series = Series.linear("Onion", 30, 100, 1);
        double oneDay = service.forecast(series, 1).result().predictedPrice();
        double month = service.forecast(series, 30).result().predictedPrice();

        assertThat(month).isEqualTo(oneDay);
    }

    @Test
    void storedModelPredictsWithoutRefitting() {
        List<MarketObservation> series = Series.linear("Onion", 30, 100, 1);
        PriceForecast trained = service.forecast(series, 7);

        ForecastResult again = service.predict(trained.model(), series);
        assertThat(again).isEqualTo(trained.result());
    }

    @Test
    void concurrentForecastsKeepTheirOwnScaling() throws Exception {
        List<MarketObservation> onion = Series.linear("Onion", 40, 100, 1);
        List<MarketObservation> tomato = Series.linear("Tomato", 35, 5000, -20);

        PriceForecast onionAlone = service.forecast(onion, 7);
        PriceForecast tomatoAlone = service.forecast(tomato, 7);

        Future<PriceForecast> onionFuture = pool.submit(() -> service.forecast(onion, 7));
        Future<PriceForecast> tomatoFuture = pool.submit(() -> service.forecast(tomato, 7));
        PriceForecast onionConcurrent = onionFuture.get();
        PriceForecast tomatoConcurrent = tomatoFuture.get();

        assertThat(onionConcurrent.model().scaling()).isEqualTo(onionAlone.model().scaling());
        assertThat(tomatoConcurrent.model().scaling()).isEqualTo(tomatoAlone.model().scaling());
        assertThat(onionConcurrent.model().scaling()).isNotEqualTo(tomatoConcurrent.model().scaling());
        assertThat(onionConcurrent.result().predictedPrice())
            .isCloseTo(onionAlone.result().predictedPrice(), within(1e-9));
        assertThat(tomatoConcurrent.result().predictedPrice())
            .isCloseTo(tomatoAlone.result().predictedPrice(), within(1e-9));
    }
}

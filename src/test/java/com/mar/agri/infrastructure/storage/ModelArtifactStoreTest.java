package com.mar.agri.infrastructure.storage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.ModelArtifactNotFoundException;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.PriceForecast;
import com.mar.agri.domain.model.ScalingParameters;
import com.mar.agri.domain.model.TrainedForecastModel;
import com.mar.agri.service.DatasetSplitter;
import com.mar.agri.service.FeatureBuilder;
import com.mar.agri.service.FeatureScaler;
import com.mar.agri.service.ForecastEvaluator;
import com.mar.agri.service.PriceForecastService;
import com.mar.agri.service.Series;
import com.mar.agri.service.regression.EnsembleRegressor;
import com.mar.agri.service.regression.RegressorKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelArtifactStoreTest {

    @TempDir
    Path dir;

    private PriceForecastService forecaster;
    private ModelArtifactStore store;

    @BeforeEach
    void setUp() {
        AppProperties props = new AppProperties();
        props.getForest().setTrees(10);
        props.getBoosting().setStages(12);
        forecaster = new PriceForecastService(props, new FeatureBuilder(props), new FeatureScaler(),
            new DatasetSplitter(), new EnsembleRegressor(props), new ForecastEvaluator(props));
        store = new ModelArtifactStore(dir, new ObjectMapper());
    }

    @Test
    void keyCombinesSanitizedCommodityAndState() {
        assertThat(ModelArtifactStore.keyFor("Green Chilli", null)).isEqualTo("Green_Chilli");
        assertThat(ModelArtifactStore.keyFor("Green Chilli", " ")).isEqualTo("Green_Chilli");
        assertThat(ModelArtifactStore.keyFor("Onion", "Tamil Nadu")).isEqualTo("Onion__Tamil_Nadu");
    }

    @Test
    void reloadedModelForecastsLikeTheOriginal() throws Exception {
        List<MarketObservation> series = Series.linear("Onion", 30, 100, 1);
        PriceForecast trained = forecaster.forecast(series, 7);

        Path saved = store.save("Onion", "Punjab", trained.model());
        assertThat(saved).isEqualTo(dir.resolve("Onion__Punjab"));
        assertThat(saved.resolve("manifest.json")).exists();
        assertThat(saved.resolve("forest.tribuo")).exists();
        try (var stages = Files.list(saved.resolve("boost"))) {
            assertThat(stages.count()).isEqualTo(12);
        }
        assertThat(store.exists("Onion__Punjab")).isTrue();

        TrainedForecastModel loaded = store.load("Onion__Punjab");
        assertThat(loaded.scaling()).isEqualTo(trained.model().scaling());
        assertThat(loaded.metrics()).isEqualTo(trained.model().metrics());
        assertThat(loaded.trainingSamples()).isEqualTo(21);
        assertThat(loaded.regressors().forest().kind()).isEqualTo(RegressorKind.RANDOM_FOREST);
        assertThat(loaded.regressors().boosting().kind()).isEqualTo(RegressorKind.GRADIENT_BOOSTING);

        ForecastResult fromDisk = forecaster.predict(loaded, series);
        assertThat(fromDisk).isEqualTo(trained.result());
    }

    @Test
    void savingAgainReplacesThePreviousModel() throws Exception {
        store.save("Onion", null, forecaster.forecast(Series.linear("Onion", 30, 100, 1), 7).model());
        PriceForecast second = forecaster.forecast(Series.constant("Onion", 25, 50), 7);
        store.save("Onion", null, second.model());

        assertThat(store.load("Onion").scaling()).isEqualTo(second.model().scaling());
    }

    @Test
    void manifestIsIndentedWithoutChangingTheSharedMapper() throws Exception {
        ObjectMapper shared = new ObjectMapper();
        ModelArtifactStore indented = new ModelArtifactStore(dir, shared);

        Path saved = indented.save("Onion", null, forecaster.forecast(Series.linear("Onion", 30, 100, 1), 7).model());

        assertThat(Files.readString(saved.resolve("manifest.json"))).contains("\n  \"commodity\"");
        assertThat(shared.isEnabled(SerializationFeature.INDENT_OUTPUT)).isFalse();
    }

    @Test
    void loadsDuringRepeatedSavesSeeWholeModels() throws Exception {
        TrainedForecastModel rising = forecaster.forecast(Series.linear("Onion", 30, 100, 1), 7).model();
        TrainedForecastModel flat = forecaster.forecast(Series.constant("Onion", 25, 50), 7).model();
        store.save("Onion", null, rising);

        ExecutorService workers = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = workers.submit(() -> {
                for (int i = 0; i < 10; i++) {
                    store.save("Onion", null, i % 2 == 0 ? flat : rising);
                }
                return null;
            });
            Future<?> reader = workers.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    ScalingParameters scaling = store.load("Onion").scaling();
                    assertThat(scaling).isIn(rising.scaling(), flat.scaling());
                }
                return null;
            });
            writer.get();
            reader.get();
        } finally {
            workers.shutdownNow();
        }
    }

    @Test
    void missingModelIsReported() {
        assertThat(store.exists("Garlic")).isFalse();
        assertThatThrownBy(() -> store.load("Garlic"))
            .isInstanceOf(ModelArtifactNotFoundException.class)
            .hasMessageContaining("Garlic");
    }
}

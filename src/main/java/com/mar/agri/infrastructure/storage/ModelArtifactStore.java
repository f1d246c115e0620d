package com.mar.agri.infrastructure.storage;

import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.regression.Regressor;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.ModelArtifactNotFoundException;
import com.mar.agri.domain.model.FeatureRow;
import com.mar.agri.domain.model.ModelMetrics;
import com.mar.agri.domain.model.ScalingParameters;
import com.mar.agri.domain.model.TrainedForecastModel;
import com.mar.agri.service.regression.BoostedRegressor;
import com.mar.agri.service.regression.ForestRegressor;
import com.mar.agri.service.regression.RegressorPair;

/**
 * Stores trained forecast models on disk, one directory per commodity (and state):
 *
 * <pre>
 * models/Onion__Punjab/
 *   manifest.json          scaling parameters, boosting constants, metrics
 *   forest.tribuo
 *   boost/stage-000.tribuo ...
 * </pre>
 *
 * Saves hold the write lock while a directory is replaced, so a concurrent load never sees
 * a half-written model.
 */
@Slf4j
@Component
public class ModelArtifactStore {

    private static final String MANIFEST = "manifest.json";
    private static final String FOREST = "forest.tribuo";
    private static final String BOOST_DIR = "boost";

    private final Path root;
    private final ObjectMapper om;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public ModelArtifactStore(AppProperties props, ObjectMapper objectMapper) {
        this(Path.of(props.getModels().getDir()), objectMapper);
    }

    public ModelArtifactStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.om = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path root() {
        return root;
    }

    /** Directory name for a commodity, suffixed with the state when one is given. */
    public static String keyFor(String commodity, String state) {
        String key = sanitize(commodity);
        if (state != null && !state.isBlank()) {
            key += "__" + sanitize(state);
        }
        return key;
    }

    public boolean exists(String key) {
        return Files.exists(root.resolve(key).resolve(MANIFEST));
    }

    public Path save(String commodity, String state, TrainedForecastModel model) throws IOException {
        if (!(model.regressors().forest() instanceof ForestRegressor forest)
            || !(model.regressors().boosting() instanceof BoostedRegressor boosted)) {
            throw new IllegalArgumentException("unsupported regressor pair: " + model.regressors());
        }
        String key = keyFor(commodity, state);
        Path dir = root.resolve(key);
        List<Model<Regressor>> stages = boosted.stages();
        Manifest manifest = new Manifest(commodity, state, Instant.now().toString(),
            FeatureRow.FEATURE_NAMES, model.scaling().means(), model.scaling().scales(),
            boosted.baseline(), boosted.learningRate(), stages.size(),
            model.metrics(), model.trainingSamples(), model.testSamples());

        lock.writeLock().lock();
        try {
            deleteRecursively(dir);
            Files.createDirectories(dir.resolve(BOOST_DIR));
            forest.model().serializeToFile(dir.resolve(FOREST));
            for (int i = 0; i < stages.size(); i++) {
                stages.get(i).serializeToFile(dir.resolve(BOOST_DIR).resolve(stageFile(i)));
            }
            // manifest last: exists() is keyed on it
            om.writeValue(dir.resolve(MANIFEST).toFile(), manifest);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("TRAIN | saved model {} to {}", key, dir.toAbsolutePath());
        return dir;
    }

    public TrainedForecastModel load(String key) throws IOException {
        lock.readLock().lock();
        try {
            return read(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    private TrainedForecastModel read(String key) throws IOException {
        Path dir = root.resolve(key);
        if (!exists(key)) {
            throw new ModelArtifactNotFoundException(key);
        }
        Manifest manifest = om.readValue(dir.resolve(MANIFEST).toFile(), Manifest.class);
        if (!FeatureRow.FEATURE_NAMES.equals(manifest.featureNames())) {
            throw new IOException("model " + key + " was trained on features " + manifest.featureNames());
        }

        Model<Regressor> forest = readModel(dir.resolve(FOREST));
        List<Model<Regressor>> stages = new ArrayList<>(manifest.boostingStages());
        for (int i = 0; i < manifest.boostingStages(); i++) {
            stages.add(readModel(dir.resolve(BOOST_DIR).resolve(stageFile(i))));
        }

        RegressorPair pair = new RegressorPair(new ForestRegressor(forest),
            new BoostedRegressor(manifest.boostingBaseline(), manifest.boostingLearningRate(), stages));
        return new TrainedForecastModel(new ScalingParameters(manifest.means(), manifest.scales()), pair,
            manifest.metrics(), manifest.trainingSamples(), manifest.testSamples());
    }

    private static Model<Regressor> readModel(Path path) throws IOException {
        @SuppressWarnings("unchecked")
        Model<Regressor> model = (Model<Regressor>) Model.deserializeFromFile(path);
        return model;
    }

    private static String stageFile(int i) {
        return String.format("stage-%03d.tribuo", i);
    }

    private static String sanitize(String s) {
        return s.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    record Manifest(
        @JsonProperty("commodity") String commodity,
        @JsonProperty("state") String state,
        @JsonProperty("trained_at") String trainedAt,
        @JsonProperty("feature_names") List<String> featureNames,
        @JsonProperty("means") double[] means,
        @JsonProperty("scales") double[] scales,
        @JsonProperty("boosting_baseline") double boostingBaseline,
        @JsonProperty("boosting_learning_rate") double boostingLearningRate,
        @JsonProperty("boosting_stages") int boostingStages,
        @JsonProperty("metrics") ModelMetrics metrics,
        @JsonProperty("training_samples") int trainingSamples,
        @JsonProperty("test_samples") int testSamples
    ) {}
}

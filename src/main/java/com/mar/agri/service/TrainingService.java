package com.mar.agri.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.stereotype.Service;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.InsufficientDataException;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.PriceForecast;
import com.mar.agri.domain.model.TrainedForecastModel;
import com.mar.agri.domain.model.TrainingProgress;
import com.mar.agri.domain.model.TrainingSummary;
import com.mar.agri.infrastructure.storage.ModelArtifactStore;

/**
 * Offline batch training: runs the forecast pipeline for every commodity in the table and
 * persists each trained model, then serves forecasts from those stored models.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingService {

    static final String SUMMARY_FILE = "training_summary.csv";

    private final AppProperties props;
    private final ObservationRepository repository;
    private final PriceForecastService forecastService;
    private final ModelArtifactStore store;

    public TrainingSummary trainAll(int horizon, Consumer<TrainingProgress> listener) throws IOException {
        List<String> commodities = repository.commodities();
        int minRows = props.getForecast().getMinRows();
        log.info("TRAIN | starting batch over {} commodities", commodities.size());

        List<TrainingSummary.CommodityScore> scores = new ArrayList<>();
        int skipped = 0;
        int failed = 0;
        for (int i = 0; i < commodities.size(); i++) {
            String commodity = commodities.get(i);
            List<MarketObservation> series = repository.findByCommodity(commodity, null);
            int index = i + 1;

            if (series.size() < minRows) {
                log.warn("TRAIN | [{}/{}] {} skipped: {} observations, need {}", index, commodities.size(), commodity, series.size(), minRows);
                skipped++;
                listener.accept(new TrainingProgress(index, commodities.size(), commodity,
                    TrainingProgress.Status.SKIPPED, "insufficient data (" + series.size() + " rows)"));
                continue;
            }

            try {
                PriceForecast forecast = forecastService.forecast(series, horizon);
                store.save(commodity, null, forecast.model());
                var m = forecast.result().modelMetrics();
                scores.add(new TrainingSummary.CommodityScore(commodity, m.accuracy(), m.mae(), m.r2Score()));
                log.info("TRAIN | [{}/{}] {} accuracy={}", index, commodities.size(), commodity, String.format("%.2f", m.accuracy()));
                listener.accept(new TrainingProgress(index, commodities.size(), commodity,
                    TrainingProgress.Status.TRAINED, String.format("accuracy %.2f%%", m.accuracy())));
            } catch (InsufficientDataException e) {
                log.warn("TRAIN | [{}/{}] {} skipped: {}", index, commodities.size(), commodity, e.getMessage());
                skipped++;
                listener.accept(new TrainingProgress(index, commodities.size(), commodity,
                    TrainingProgress.Status.SKIPPED, e.getMessage()));
            } catch (Exception e) {
                log.error("TRAIN | [{}/{}] {} failed", index, commodities.size(), commodity, e);
                failed++;
                listener.accept(new TrainingProgress(index, commodities.size(), commodity,
                    TrainingProgress.Status.FAILED, String.valueOf(e.getMessage())));
            }
        }

        if (!scores.isEmpty()) {
            writeSummary(scores, store.root().resolve(SUMMARY_FILE));
        }
        TrainingSummary summary = summarize(scores, skipped, failed);
        log.info("TRAIN | done: trained={} skipped={} failed={} avgAccuracy={}", summary.trained(), skipped, failed,
            String.format("%.2f", summary.averageAccuracy()));
        return summary;
    }

    /** Forecast from the stored model for this commodity (and state) without refitting. */
    public ForecastResult predictFromArtifact(String commodity, String state) throws IOException {
        TrainedForecastModel model = store.load(ModelArtifactStore.keyFor(commodity, state));
        return forecastService.predict(model, repository.findByCommodity(commodity, state));
    }

    public boolean hasArtifact(String commodity, String state) {
        return store.exists(ModelArtifactStore.keyFor(commodity, state));
    }

    TrainingSummary summarize(List<TrainingSummary.CommodityScore> scores, int skipped, int failed) {
        double avgAccuracy = scores.stream().mapToDouble(TrainingSummary.CommodityScore::accuracy).average().orElse(0.0);
        double avgMae = scores.stream().mapToDouble(TrainingSummary.CommodityScore::mae).average().orElse(0.0);
        double avgR2 = scores.stream().mapToDouble(TrainingSummary.CommodityScore::r2Score).average().orElse(0.0);
        List<TrainingSummary.CommodityScore> top = scores.stream()
            .sorted(Comparator.comparingDouble(TrainingSummary.CommodityScore::accuracy).reversed())
            .limit(props.getTraining().getTopModels())
            .toList();
        return new TrainingSummary(scores.size(), skipped, failed, avgAccuracy, avgMae, avgR2, top);
    }

    private void writeSummary(List<TrainingSummary.CommodityScore> scores, Path path) throws IOException {
        Files.createDirectories(path.getParent());
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader("commodity", "accuracy", "mae", "r2_score").build();
        try (BufferedWriter writer = Files.newBufferedWriter(path);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (TrainingSummary.CommodityScore s : scores) {
                printer.printRecord(s.commodity(), s.accuracy(), s.mae(), s.r2Score());
            }
        }
        log.info("TRAIN | wrote training summary to {}", path.toAbsolutePath());
    }
}

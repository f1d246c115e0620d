package com.mar.agri.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.TrainingSummary;
import com.mar.agri.service.ObservationRepository;
import com.mar.agri.service.PriceForecastService;
import com.mar.agri.service.TrainingService;

@Slf4j
@Configuration
public class CliRunner {

    @Bean
    CommandLineRunner runner(TrainingService training, PriceForecastService forecaster,
                             ObservationRepository repository, AppProperties props) {
        return args -> {
            if (args.length == 0) {
                System.out.println("Usage: train|predict|test [--commodity Onion] [--state Punjab] [--horizon 7]");
                return;
            }
            String cmd = args[0];
            int horizon = Integer.parseInt(getArg(args, "--horizon", String.valueOf(props.getForecast().getDefaultHorizon())));

            switch (cmd) {
                case "train" -> {
                    TrainingSummary summary = training.trainAll(horizon,
                        p -> System.out.printf("[%d/%d] %-20s %s %s%n", p.index(), p.total(), p.commodity(), p.status(), p.message()));
                    System.out.printf("Trained %d, skipped %d, failed %d%n", summary.trained(), summary.skipped(), summary.failed());
                    System.out.printf("Average accuracy %.2f%%  MAE %.2f  R2 %.4f%n",
                        summary.averageAccuracy(), summary.averageMae(), summary.averageR2Score());
                    summary.topModels().forEach(s ->
                        System.out.printf("  %-20s accuracy %.2f%%%n", s.commodity(), s.accuracy()));
                }
                case "predict" -> {
                    String commodity = getArg(args, "--commodity", null);
                    if (commodity == null) {
                        System.err.println("predict needs --commodity");
                        return;
                    }
                    String state = getArg(args, "--state", null);
                    ForecastResult result = training.hasArtifact(commodity, state)
                        ? training.predictFromArtifact(commodity, state)
                        : forecaster.forecast(repository.findByCommodity(commodity, state), horizon).result();
                    print(commodity, result);
                }
                case "test" -> {
                    for (String commodity : props.getTraining().getSampleCommodities()) {
                        if (!training.hasArtifact(commodity, null)) {
                            System.out.println(commodity + ": no stored model, run 'train' first");
                            continue;
                        }
                        try {
                            print(commodity, training.predictFromArtifact(commodity, null));
                        } catch (RuntimeException e) {
                            log.warn("CLI | stored model for {} could not forecast: {}", commodity, e.getMessage());
                            System.out.println(commodity + ": " + e.getMessage());
                        }
                    }
                }
                default -> System.out.println("Unknown command: " + cmd);
            }
        };
    }

    private static void print(String commodity, ForecastResult r) {
        System.out.printf("%s: current %.2f -> predicted %.2f (%+.2f%%), interval [%.2f, %.2f], accuracy %.2f%%%n",
            commodity, r.currentPrice(), r.predictedPrice(), r.priceChangePercent(),
            r.confidenceInterval().lower(), r.confidenceInterval().upper(), r.modelMetrics().accuracy());
    }

    private static String getArg(String[] args, String key, String def) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(key)) return args[i + 1];
        }
        return def;
    }
}

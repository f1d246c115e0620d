package com.mar.agri.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.exception.TrainingInProgressException;
import com.mar.agri.domain.model.CommodityRequest;
import com.mar.agri.domain.model.ForecastResult;
import com.mar.agri.domain.model.JobResponse;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.PriceForecastRequest;
import com.mar.agri.domain.model.TrainingSummary;
import com.mar.agri.infrastructure.messaging.SseHub;
import com.mar.agri.service.ObservationRepository;
import com.mar.agri.service.PriceForecastService;
import com.mar.agri.service.TrainingService;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ForecastController {

    private final AppProperties props;
    private final ObservationRepository repository;
    private final PriceForecastService forecastService;
    private final TrainingService trainingService;
    private final SseHub hub;

    private final ExecutorService pool = Executors.newCachedThreadPool();
    // one batch run at a time: runs rewrite the same artifact directories
    private final AtomicReference<String> runningJob = new AtomicReference<>();

    /** Trains on the current table and forecasts the next price for one commodity. */
    @PostMapping("/predict/price")
    public ForecastResult predictPrice(@Valid @RequestBody PriceForecastRequest request) {
        List<MarketObservation> series = repository.findByCommodity(request.commodity(), request.state());
        int horizon = request.horizonOrDefault(props.getForecast().getDefaultHorizon());
        return forecastService.forecast(series, horizon).result();
    }

    /** Forecasts with the stored model from the last batch training run. */
    @PostMapping("/predict/price/stored")
    public ForecastResult predictStored(@Valid @RequestBody CommodityRequest request) throws IOException {
        return trainingService.predictFromArtifact(request.commodity(), request.state());
    }

    @PostMapping("/train")
    public JobResponse train(@RequestParam(name = "horizon", required = false) Integer horizon) {
        int h = horizon != null ? horizon : props.getForecast().getDefaultHorizon();
        if (h < 1) {
            throw new IllegalArgumentException("horizon must be a positive number of days, got " + h);
        }
        String jobId = "train-" + System.currentTimeMillis();
        if (!runningJob.compareAndSet(null, jobId)) {
            throw new TrainingInProgressException(runningJob.get());
        }
        pool.submit(() -> {
            try {
                TrainingSummary summary = trainingService.trainAll(h, progress -> hub.publish(jobId, "progress", progress));
                hub.publish(jobId, "summary", summary);
            } catch (Exception e) {
                log.error("TRAIN | job {} failed", jobId, e);
                hub.publish(jobId, "error", Map.of("error", String.valueOf(e.getMessage())));
            } finally {
                runningJob.set(null);
                hub.complete(jobId);
            }
        });
        return new JobResponse(jobId);
    }

    @GetMapping(path = "/stream/{jobId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("jobId") String jobId) {
        return hub.connect(jobId);
    }

    @GetMapping(value = "/result/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public String result(@PathVariable("jobId") String jobId) {
        return hub.getLast(jobId);
    }

    @PreDestroy
    void shutdown() {
        pool.shutdown();
    }
}

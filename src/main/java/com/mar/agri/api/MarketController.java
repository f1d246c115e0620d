package com.mar.agri.api;

import lombok.RequiredArgsConstructor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import com.mar.agri.domain.model.CommodityRequest;
import com.mar.agri.domain.model.ComparisonRequest;
import com.mar.agri.domain.model.CropRecommendation;
import com.mar.agri.domain.model.CropRecommendationRequest;
import com.mar.agri.domain.model.DataSummary;
import com.mar.agri.domain.model.DemandForecast;
import com.mar.agri.domain.model.PriceComparison;
import com.mar.agri.domain.model.ProfitabilityReport;
import com.mar.agri.domain.model.ProfitabilityRequest;
import com.mar.agri.domain.model.YieldEstimate;
import com.mar.agri.domain.model.YieldRequest;
import com.mar.agri.service.MarketAnalyticsService;
import com.mar.agri.service.ObservationRepository;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MarketController {

    private static final int DEFAULT_TOP_N = 10;

    private final ObservationRepository repository;
    private final MarketAnalyticsService analytics;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "healthy");
        out.put("message", "Commodity forecasting API is running");
        out.put("total_records", repository.size());
        out.put("commodities", repository.commodities().size());
        out.put("states", repository.states().size());
        return out;
    }

    @GetMapping("/data/summary")
    public DataSummary summary() {
        return analytics.summary();
    }

    @GetMapping("/data/commodities")
    public Map<String, List<String>> commodities() {
        return Map.of("commodities", repository.commodities());
    }

    @GetMapping("/data/states")
    public Map<String, List<String>> states() {
        return Map.of("states", repository.states());
    }

    @PostMapping("/recommend/crops")
    public Map<String, List<CropRecommendation>> recommendCrops(@Valid @RequestBody CropRecommendationRequest request) {
        int topN = request.topN() != null ? request.topN() : DEFAULT_TOP_N;
        return Map.of("recommendations", analytics.recommendCrops(request.state(), topN));
    }

    @PostMapping("/predict/yield")
    public YieldEstimate predictYield(@Valid @RequestBody YieldRequest request) {
        return analytics.estimateYield(request.commodity(), request.landSize(),
            orZero(request.fertilizerCost()), orZero(request.irrigationCost()), orZero(request.laborCost()),
            request.state());
    }

    @PostMapping("/forecast/demand")
    public DemandForecast forecastDemand(@Valid @RequestBody CommodityRequest request) {
        return analytics.forecastDemand(request.commodity(), request.state());
    }

    @PostMapping("/analyze/profitability")
    public ProfitabilityReport analyzeProfitability(@Valid @RequestBody ProfitabilityRequest request) {
        return analytics.analyzeProfitability(request.commodity(), request.state(),
            request.totalCost(), request.expectedYield());
    }

    @PostMapping("/compare/prices")
    public PriceComparison comparePrices(@Valid @RequestBody ComparisonRequest request) {
        return analytics.comparePrices(request.commodity(), request.type());
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }
}

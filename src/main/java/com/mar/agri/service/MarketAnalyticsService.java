package com.mar.agri.service;

import lombok.RequiredArgsConstructor;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import com.mar.agri.domain.exception.NoDataException;
import com.mar.agri.domain.model.CropRecommendation;
import com.mar.agri.domain.model.DataSummary;
import com.mar.agri.domain.model.DemandForecast;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.domain.model.PriceComparison;
import com.mar.agri.domain.model.ProfitabilityReport;
import com.mar.agri.domain.model.YieldEstimate;
import com.mar.agri.util.FeatureStats;

/**
 * Closed-form market scoring over grouped price statistics: crop ranking, yield and revenue
 * estimates, demand outlook, profitability scenarios and cross-location comparison.
 */
@Service
@RequiredArgsConstructor
public class MarketAnalyticsService {

    /** Typical yield per acre in quintals. */
    static final Map<String, Double> BASE_YIELDS = Map.ofEntries(
        Map.entry("Rice", 25.0), Map.entry("Wheat", 30.0), Map.entry("Potato", 200.0),
        Map.entry("Onion", 150.0), Map.entry("Tomato", 180.0), Map.entry("Cotton", 15.0),
        Map.entry("Sugarcane", 350.0), Map.entry("Maize", 28.0), Map.entry("Soybean", 12.0),
        Map.entry("Groundnut", 15.0), Map.entry("Bajra", 10.0), Map.entry("Jowar", 12.0),
        Map.entry("Tur", 8.0), Map.entry("Gram", 10.0), Map.entry("Mustard", 12.0),
        Map.entry("Sunflower", 10.0));
    static final double DEFAULT_BASE_YIELD = 20.0;

    private final ObservationRepository repository;

    public DataSummary summary() {
        List<MarketObservation> all = repository.findAll();
        double[] prices = prices(all);
        LocalDate start = all.stream().map(MarketObservation::arrivalDate).min(Comparator.naturalOrder()).orElse(null);
        LocalDate end = all.stream().map(MarketObservation::arrivalDate).max(Comparator.naturalOrder()).orElse(null);
        return new DataSummary(
            all.size(),
            countDistinct(all, MarketObservation::commodity),
            countDistinct(all, MarketObservation::state),
            countDistinct(all, MarketObservation::district),
            countDistinct(all, MarketObservation::market),
            prices.length == 0 ? 0.0 : FeatureStats.mean(prices),
            prices.length == 0 ? 0.0 : max(prices),
            prices.length == 0 ? 0.0 : min(prices),
            new DataSummary.DateRange(start, end));
    }

    public List<CropRecommendation> recommendCrops(String state, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("top_n must be positive, got " + topN);
        }
        Map<String, double[]> byCommodity = group(repository.findByState(state), MarketObservation::commodity);
        if (byCommodity.isEmpty()) {
            return List.of();
        }

        double maxCount = byCommodity.values().stream().mapToInt(p -> p.length).max().orElse(1);
        double maxAvg = byCommodity.values().stream().mapToDouble(FeatureStats::mean).max().orElse(1.0);

        List<CropRecommendation> out = new ArrayList<>();
        for (Map.Entry<String, double[]> e : byCommodity.entrySet()) {
            double[] p = e.getValue();
            double avg = FeatureStats.mean(p);
            double stability = clamp(1.0 - FeatureStats.sampleStd(p) / avg, 0.0, 1.0);
            double availability = p.length / maxCount;
            double profit = avg / maxAvg;
            double score = (profit * 0.4 + stability * 0.3 + availability * 0.3) * 100.0;
            out.add(new CropRecommendation(e.getKey(), score, avg,
                stability * 100.0, availability * 100.0, profit * 100.0, p.length,
                new CropRecommendation.PriceRange(min(p), max(p)),
                recommendationReason(score)));
        }
        out.sort(Comparator.comparingDouble(CropRecommendation::score).reversed());
        return out.subList(0, Math.min(topN, out.size()));
    }

    static String recommendationReason(double score) {
        if (score >= 70) return "Excellent choice: High prices, stable market, good availability";
        if (score >= 50) return "Good option: Balanced price and market conditions";
        if (score >= 30) return "Moderate choice: Consider market risks";
        return "Risky option: Low prices or unstable market";
    }

    public YieldEstimate estimateYield(String commodity, double landSize,
                                       double fertilizer, double irrigation, double labor, String state) {
        if (commodity == null || commodity.isBlank() || landSize <= 0) {
            throw new IllegalArgumentException("Commodity and a positive land_size are required");
        }
        double baseYield = BASE_YIELDS.getOrDefault(commodity, DEFAULT_BASE_YIELD);

        double fertilizerFactor = fertilizer > 0 ? Math.min(fertilizer / 10000.0, 1.5) : 0.5;
        double irrigationFactor = irrigation > 0 ? Math.min(irrigation / 5000.0, 1.3) : 0.6;
        double laborFactor = labor > 0 ? Math.min(labor / 15000.0, 1.2) : 0.7;
        double efficiency = (fertilizerFactor + irrigationFactor + laborFactor) / 3.0;

        double expected = baseYield * landSize * efficiency;

        double[] history = prices(repository.findByCommodity(commodity, state));
        double avgPrice = history.length > 0 ? FeatureStats.mean(history) : Double.NaN;
        if (history.length > 0) {
            // pricier markets tend to reward better quality produce
            expected *= 0.9 + (avgPrice / max(history)) * 0.2;
        }

        double variance = expected * 0.2;
        double minYield = Math.max(0.0, expected - variance);
        double maxYield = expected + variance;

        int inputs = (fertilizer > 0 ? 1 : 0) + (irrigation > 0 ? 1 : 0) + (labor > 0 ? 1 : 0);
        double confidence = inputs / 3.0 * 100.0;

        YieldEstimate.RevenueEstimate revenue = history.length == 0 ? null
            : new YieldEstimate.RevenueEstimate(minYield * avgPrice, expected * avgPrice, maxYield * avgPrice, avgPrice);

        return new YieldEstimate(commodity, landSize,
            round(expected, 1), round(minYield, 1), round(maxYield, 1),
            Math.round(confidence), round(efficiency * 100.0, 1),
            new YieldEstimate.Factors(round(fertilizerFactor * 100.0, 1),
                round(irrigationFactor * 100.0, 1), round(laborFactor * 100.0, 1)),
            revenue);
    }

    public DemandForecast forecastDemand(String commodity, String state) {
        List<MarketObservation> rows = requireRows(commodity, state);
        double[] prices = prices(rows);
        double avg = FeatureStats.mean(prices);
        double max = max(prices);
        double std = FeatureStats.std(prices);

        String demand;
        if (avg > max * 0.7) demand = "high";
        else if (avg > max * 0.4) demand = "medium";
        else demand = "low";

        double volatility = avg > 0 ? std / avg : 0.0;
        String trend;
        String direction;
        double multiplier;
        if (volatility > 0.5) {
            trend = "increasing";
            direction = "up";
            multiplier = 1.05;
        } else if (volatility < 0.2) {
            trend = "stable";
            direction = "stable";
            multiplier = 1.0;
        } else {
            trend = "decreasing";
            direction = "down";
            multiplier = 0.95;
        }

        double confidence = Math.min(rows.size(), 95);

        String recommendation;
        if (demand.equals("high") && trend.equals("increasing")) {
            recommendation = "Excellent time to sell! High demand and rising prices.";
        } else if (demand.equals("high") && trend.equals("stable")) {
            recommendation = "Good market conditions. Consider selling soon.";
        } else if (demand.equals("medium")) {
            recommendation = "Moderate market. Monitor prices before selling.";
        } else {
            recommendation = "Low demand. Consider storing or waiting for better prices.";
        }

        double strength = (levelScore(demand) + levelScore(trend)) / 2.0;

        return new DemandForecast(rows.get(0).commodity(), demand, trend, direction,
            Math.round(avg * multiplier), Math.round(avg),
            new DemandForecast.PriceSpread(min(prices), max, round(std, 2)),
            round(volatility, 3), Math.round(confidence), round(strength, 1),
            recommendation, rows.size());
    }

    private static double levelScore(String level) {
        return switch (level) {
            case "high", "increasing" -> 90.0;
            case "medium", "stable" -> 60.0;
            default -> 30.0;
        };
    }

    public ProfitabilityReport analyzeProfitability(String commodity, String state, double totalCost, double expectedYield) {
        if (totalCost <= 0 || expectedYield <= 0) {
            throw new IllegalArgumentException("commodity, total_cost, and expected_yield are required");
        }
        double[] prices = prices(requireRows(commodity, state));
        return new ProfitabilityReport(
            scenario(max(prices), totalCost, expectedYield),
            scenario(FeatureStats.mean(prices), totalCost, expectedYield),
            scenario(min(prices), totalCost, expectedYield),
            totalCost / expectedYield);
    }

    private static ProfitabilityReport.Scenario scenario(double price, double totalCost, double expectedYield) {
        double revenue = price * expectedYield;
        double profit = revenue - totalCost;
        return new ProfitabilityReport.Scenario(price, revenue, profit, profit / totalCost * 100.0);
    }

    public PriceComparison comparePrices(String commodity, PriceComparison.Type type) {
        List<MarketObservation> rows = requireRows(commodity, null);
        Function<MarketObservation, String> key = type == PriceComparison.Type.MARKET
            ? MarketObservation::market
            : MarketObservation::state;

        List<PriceComparison.LocationPrice> locations = group(rows, key).entrySet().stream()
            .map(e -> new PriceComparison.LocationPrice(e.getKey(), FeatureStats.mean(e.getValue()),
                min(e.getValue()), max(e.getValue()), e.getValue().length))
            .sorted(Comparator.comparingDouble(PriceComparison.LocationPrice::avgPrice).reversed())
            .toList();

        if (locations.isEmpty()) {
            // every row lacks the grouping field
            return new PriceComparison(locations, null, null, new PriceComparison.PriceSpan(0.0, 0.0, 0.0));
        }
        double highest = locations.get(0).avgPrice();
        double lowest = locations.get(locations.size() - 1).avgPrice();
        return new PriceComparison(locations,
            locations.get(0).location(), locations.get(locations.size() - 1).location(),
            new PriceComparison.PriceSpan(highest, lowest, highest - lowest));
    }

    private List<MarketObservation> requireRows(String commodity, String state) {
        if (commodity == null || commodity.isBlank()) {
            throw new IllegalArgumentException("Commodity is required");
        }
        List<MarketObservation> rows = repository.findByCommodity(commodity, state);
        if (rows.isEmpty()) {
            throw new NoDataException("No market data available for " + commodity
                + (ObservationRepository.isBlank(state) ? "" : " in " + state));
        }
        return rows;
    }

    private static Map<String, double[]> group(List<MarketObservation> rows, Function<MarketObservation, String> key) {
        Map<String, List<Double>> grouped = rows.stream()
            .filter(o -> key.apply(o) != null)
            .collect(Collectors.groupingBy(key, LinkedHashMap::new,
                Collectors.mapping(MarketObservation::modalPrice, Collectors.toList())));
        Map<String, double[]> out = new LinkedHashMap<>();
        grouped.forEach((k, v) -> out.put(k, v.stream().mapToDouble(Double::doubleValue).toArray()));
        return out;
    }

    private static int countDistinct(List<MarketObservation> rows, Function<MarketObservation, String> key) {
        return (int) rows.stream().map(key).filter(Objects::nonNull).distinct().count();
    }

    private static double[] prices(List<MarketObservation> rows) {
        return rows.stream().mapToDouble(MarketObservation::modalPrice).toArray();
    }

    private static double max(double[] v) {
        double m = Double.NEGATIVE_INFINITY;
        for (double x : v) m = Math.max(m, x);
        return m;
    }

    private static double min(double[] v) {
        double m = Double.POSITIVE_INFINITY;
        for (double x : v) m = Math.min(m, x);
        return m;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    static double round(double v, int places) {
        double scale = Math.pow(10, places);
        return Math.round(v * scale) / scale;
    }
}

package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DemandForecast(
    @JsonProperty("commodity") String commodity,
    @JsonProperty("current_demand") String currentDemand,
    @JsonProperty("trend") String trend,
    @JsonProperty("trend_direction") String trendDirection,
    @JsonProperty("forecasted_price") double forecastedPrice,
    @JsonProperty("current_avg_price") double currentAvgPrice,
    @JsonProperty("price_range") PriceSpread priceRange,
    @JsonProperty("volatility") double volatility,
    @JsonProperty("confidence_percent") double confidencePercent,
    @JsonProperty("market_strength") double marketStrength,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("data_points") int dataPoints
) {
    public record PriceSpread(double min, double max, double std) {}
}

package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record YieldEstimate(
    @JsonProperty("commodity") String commodity,
    @JsonProperty("land_size_acres") double landSizeAcres,
    @JsonProperty("expected_yield_quintals") double expectedYieldQuintals,
    @JsonProperty("min_yield_quintals") double minYieldQuintals,
    @JsonProperty("max_yield_quintals") double maxYieldQuintals,
    @JsonProperty("confidence_percent") double confidencePercent,
    @JsonProperty("efficiency_score") double efficiencyScore,
    @JsonProperty("factors") Factors factors,
    @JsonProperty("revenue_estimate") RevenueEstimate revenueEstimate
) {
    public record Factors(
        @JsonProperty("fertilizer_efficiency") double fertilizerEfficiency,
        @JsonProperty("irrigation_efficiency") double irrigationEfficiency,
        @JsonProperty("labor_efficiency") double laborEfficiency
    ) {}

    public record RevenueEstimate(
        @JsonProperty("min_revenue") double minRevenue,
        @JsonProperty("expected_revenue") double expectedRevenue,
        @JsonProperty("max_revenue") double maxRevenue,
        @JsonProperty("avg_market_price") double avgMarketPrice
    ) {}
}

package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profitability ranking entry for one commodity. Percent fields are on a 0-100 scale.
 */
public record CropRecommendation(
    @JsonProperty("commodity") String commodity,
    @JsonProperty("score") double score,
    @JsonProperty("avg_price") double avgPrice,
    @JsonProperty("price_stability") double priceStability,
    @JsonProperty("market_availability") double marketAvailability,
    @JsonProperty("profit_potential") double profitPotential,
    @JsonProperty("market_count") int marketCount,
    @JsonProperty("price_range") PriceRange priceRange,
    @JsonProperty("reason") String reason
) {
    public record PriceRange(double min, double max) {}
}

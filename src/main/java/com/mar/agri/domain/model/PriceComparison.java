package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record PriceComparison(
    @JsonProperty("comparison") List<LocationPrice> comparison,
    @JsonProperty("best_location") String bestLocation,
    @JsonProperty("worst_location") String worstLocation,
    @JsonProperty("price_range") PriceSpan priceRange
) {
    public enum Type { STATE, MARKET }

    public record LocationPrice(
        @JsonProperty("location") String location,
        @JsonProperty("avg_price") double avgPrice,
        @JsonProperty("min_price") double minPrice,
        @JsonProperty("max_price") double maxPrice,
        @JsonProperty("count") int count
    ) {}

    public record PriceSpan(double highest, double lowest, double difference) {}
}

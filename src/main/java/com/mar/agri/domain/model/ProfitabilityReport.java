package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProfitabilityReport(
    @JsonProperty("best_case") Scenario bestCase,
    @JsonProperty("average_case") Scenario averageCase,
    @JsonProperty("worst_case") Scenario worstCase,
    @JsonProperty("break_even_price") double breakEvenPrice
) {
    public record Scenario(
        @JsonProperty("price_per_quintal") double pricePerQuintal,
        @JsonProperty("total_revenue") double totalRevenue,
        @JsonProperty("profit") double profit,
        @JsonProperty("roi") double roi
    ) {}
}

package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ProfitabilityRequest(
    @JsonProperty("commodity") @NotBlank(message = "Commodity is required") String commodity,
    @JsonProperty("state") String state,
    @JsonProperty("total_cost") @NotNull @Positive Double totalCost,
    @JsonProperty("expected_yield") @NotNull @Positive Double expectedYield
) {}

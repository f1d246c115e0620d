package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record YieldRequest(
    @JsonProperty("commodity") @NotBlank(message = "Commodity is required") String commodity,
    @JsonProperty("land_size") @NotNull(message = "land_size is required") @Positive Double landSize,
    @JsonProperty("fertilizer_cost") @PositiveOrZero Double fertilizerCost,
    @JsonProperty("irrigation_cost") @PositiveOrZero Double irrigationCost,
    @JsonProperty("labor_cost") @PositiveOrZero Double laborCost,
    @JsonProperty("state") String state
) {}

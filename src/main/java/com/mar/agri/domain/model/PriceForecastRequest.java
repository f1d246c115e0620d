package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record PriceForecastRequest(
    @JsonProperty("commodity") @NotBlank(message = "Commodity is required") String commodity,
    @JsonProperty("state") String state,
    @JsonProperty("horizon") @Min(1) Integer horizon
) {
    public int horizonOrDefault(int fallback) {
        return horizon == null ? fallback : horizon;
    }
}

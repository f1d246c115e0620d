package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ComparisonRequest(
    @JsonProperty("commodity") @NotBlank(message = "Commodity is required") String commodity,
    @JsonProperty("comparison_type") String comparisonType
) {
    /** "market" groups by market; anything else (including absent) groups by state. */
    public PriceComparison.Type type() {
        return "market".equalsIgnoreCase(comparisonType) ? PriceComparison.Type.MARKET : PriceComparison.Type.STATE;
    }
}

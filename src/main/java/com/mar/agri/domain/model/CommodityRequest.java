package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CommodityRequest(
    @JsonProperty("commodity") @NotBlank(message = "Commodity is required") String commodity,
    @JsonProperty("state") String state
) {}

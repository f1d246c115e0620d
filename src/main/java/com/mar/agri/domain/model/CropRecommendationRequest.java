package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;

public record CropRecommendationRequest(
    @JsonProperty("state") String state,
    @JsonProperty("top_n") @Min(1) Integer topN
) {}

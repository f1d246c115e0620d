package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelMetrics(
    @JsonProperty("mae") double mae,
    @JsonProperty("r2_score") double r2Score,
    @JsonProperty("accuracy") double accuracy
) {}

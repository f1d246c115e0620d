package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

public record TrainingSummary(
    @JsonProperty("trained") int trained,
    @JsonProperty("skipped") int skipped,
    @JsonProperty("failed") int failed,
    @JsonProperty("average_accuracy") double averageAccuracy,
    @JsonProperty("average_mae") double averageMae,
    @JsonProperty("average_r2_score") double averageR2Score,
    @JsonProperty("top_models") List<CommodityScore> topModels
) {
    @JsonPropertyOrder({"commodity", "accuracy", "mae", "r2_score"})
    public record CommodityScore(
        @JsonProperty("commodity") String commodity,
        @JsonProperty("accuracy") double accuracy,
        @JsonProperty("mae") double mae,
        @JsonProperty("r2_score") double r2Score
    ) {}
}

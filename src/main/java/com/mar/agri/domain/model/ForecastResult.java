package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of one forecast invocation. The predicted price is a one-step-ahead estimate.
 */
public record ForecastResult(
    @JsonProperty("predicted_price") double predictedPrice,
    @JsonProperty("confidence_interval") ConfidenceInterval confidenceInterval,
    @JsonProperty("model_metrics") ModelMetrics modelMetrics,
    @JsonProperty("current_price") double currentPrice,
    @JsonProperty("price_change") double priceChange,
    @JsonProperty("price_change_percent") double priceChangePercent,
    @JsonProperty("training_samples") int trainingSamples,
    @JsonProperty("test_samples") int testSamples
) {}

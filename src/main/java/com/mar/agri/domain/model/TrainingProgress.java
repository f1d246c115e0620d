package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of a batch training run. {@code status} is TRAINED, SKIPPED or FAILED.
 */
public record TrainingProgress(
    @JsonProperty("index") int index,
    @JsonProperty("total") int total,
    @JsonProperty("commodity") String commodity,
    @JsonProperty("status") Status status,
    @JsonProperty("message") String message
) {
    public enum Status { TRAINED, SKIPPED, FAILED }
}

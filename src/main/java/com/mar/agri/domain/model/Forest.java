package com.mar.agri.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class Forest {
    @Min(1) private int trees = 100;
    @Min(1) private int maxDepth = 10;

    // Tribuo's RandomForestTrainer rejects a tree trainer that considers every feature
    @Positive @DecimalMax("0.99")
    private float featureFraction = 0.7f;

    private long seed = 42L;
}

package com.mar.agri.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class Boosting {
    @Min(1) private int stages = 100;
    @Min(1) private int maxDepth = 5;

    @Positive @DecimalMax("1.0")
    private double learningRate = 0.1;

    private long seed = 42L;
}

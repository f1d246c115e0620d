package com.mar.agri.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class Forecast {
    @Min(2) private int minRows = 20;

    @DecimalMin("0.05") @DecimalMax("0.5")
    private double testFraction = 0.2;

    @Min(2) private int rollingWindow = 7;

    @Min(1) private int defaultHorizon = 7;

    @Positive
    private double confidenceMultiplier = 1.5;   // interval half-width = MAE * multiplier
}

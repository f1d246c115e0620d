package com.mar.agri.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A complete engineered feature vector for one observation together with its target price.
 */
public record FeatureRow(
    LocalDate date,
    int dayOfWeek,
    int dayOfMonth,
    int month,
    int quarter,
    double priceLag1,
    double priceLag2,
    double priceLag3,
    double rollingMean,
    double rollingStd,
    double price
) {
    public static final List<String> FEATURE_NAMES = List.of(
        "day_of_week", "day_of_month", "month", "quarter",
        "price_lag_1", "price_lag_2", "price_lag_3",
        "price_rolling_mean_7", "price_rolling_std_7");

    /** Feature values in {@link #FEATURE_NAMES} order. */
    public double[] features() {
        return new double[] {
            dayOfWeek, dayOfMonth, month, quarter,
            priceLag1, priceLag2, priceLag3,
            rollingMean, rollingStd
        };
    }
}

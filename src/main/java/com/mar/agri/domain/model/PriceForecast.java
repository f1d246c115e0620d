package com.mar.agri.domain.model;

public record PriceForecast(ForecastResult result, TrainedForecastModel model) {}

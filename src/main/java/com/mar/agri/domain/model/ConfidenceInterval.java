package com.mar.agri.domain.model;

public record ConfidenceInterval(double lower, double upper) {}

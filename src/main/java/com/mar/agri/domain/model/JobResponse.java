package com.mar.agri.domain.model;

public record JobResponse(String jobId) {}

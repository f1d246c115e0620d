package com.mar.agri.domain.exception;

public class TrainingInProgressException extends RuntimeException {
    public TrainingInProgressException(String runningJobId) {
        super("A training job is already running: " + runningJobId);
    }
}

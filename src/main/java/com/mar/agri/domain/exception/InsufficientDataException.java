package com.mar.agri.domain.exception;

/**
 * Raised when a series cannot produce enough complete feature rows to train and evaluate a forecast.
 */
public class InsufficientDataException extends RuntimeException {
    private final int minRequired;
    private final int available;

    public InsufficientDataException(int minRequired, int available) {
        super("Insufficient data for training: need " + minRequired + " rows, have " + available);
        this.minRequired = minRequired;
        this.available = available;
    }

    public int getMinRequired() {
        return minRequired;
    }

    public int getAvailable() {
        return available;
    }
}

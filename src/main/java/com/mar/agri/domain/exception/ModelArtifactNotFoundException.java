package com.mar.agri.domain.exception;

public class ModelArtifactNotFoundException extends RuntimeException {
    public ModelArtifactNotFoundException(String key) {
        super("No trained model stored for " + key);
    }
}

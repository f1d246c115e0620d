package com.mar.agri.domain.exception;

public class NoDataException extends RuntimeException {
    public NoDataException(String message) {
        super(message);
    }
}

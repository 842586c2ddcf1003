package com.example.ytmdl.exception;

public class ValidationException extends QueueException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}

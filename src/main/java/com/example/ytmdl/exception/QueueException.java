package com.example.ytmdl.exception;

/**
 * Base type of errors returned synchronously by queue operations. A queue operation that throws
 * has not changed any state.
 */
public abstract class QueueException extends RuntimeException {
    protected QueueException(String message) {
        super(message);
    }

    public abstract String getErrorCode();
}

package com.example.releaseservice.exception;

public class InvalidTimestampException extends StoreException {

    public InvalidTimestampException(String message) {
        super("INVALID_TIMESTAMP", message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super("INVALID_TIMESTAMP", message, cause);
    }
}

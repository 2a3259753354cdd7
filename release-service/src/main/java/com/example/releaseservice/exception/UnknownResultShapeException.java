package com.example.releaseservice.exception;

/**
 * A task result payload could not be matched to the shape registered
 * for its task type.
 */
public class UnknownResultShapeException extends StoreException {

    public UnknownResultShapeException(String message) {
        super("UNKNOWN_RESULT_SHAPE", message);
    }

    public UnknownResultShapeException(String message, Throwable cause) {
        super("UNKNOWN_RESULT_SHAPE", message, cause);
    }
}

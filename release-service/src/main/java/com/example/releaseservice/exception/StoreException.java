package com.example.releaseservice.exception;

import lombok.Getter;

/**
 * Base exception for every error the release store surfaces to callers.
 * The code is stable and machine readable; the message is for humans.
 */
@Getter
public abstract class StoreException extends RuntimeException {

    private final String code;

    protected StoreException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected StoreException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}

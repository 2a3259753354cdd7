package com.example.releaseservice.exception;

/**
 * Two writers computed the same revision number and the retried
 * transaction collided again.
 */
public class AllocationConflictException extends ConstraintViolationException {

    public AllocationConflictException(String releaseName, int attempts, Throwable cause) {
        super(
            "ALLOCATION_CONFLICT",
            String.format("Could not allocate a revision number for %s after %d attempt(s)",
                releaseName, attempts),
            cause
        );
    }
}

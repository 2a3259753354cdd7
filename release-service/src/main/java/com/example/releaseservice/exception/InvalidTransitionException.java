package com.example.releaseservice.exception;

import com.example.releaseservice.entity.TaskStatus;

/**
 * A task status change that the task lifecycle does not allow.
 */
public class InvalidTransitionException extends StoreException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    public static InvalidTransitionException task(Long taskId, TaskStatus current, TaskStatus target) {
        return new InvalidTransitionException(
            String.format("Task %d cannot move from %s to %s", taskId, current, target)
        );
    }
}

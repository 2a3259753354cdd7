package com.example.releaseservice.entity;

import java.util.List;

/**
 * Task execution status. QUEUED → ACTIVE → {COMPLETED, FAILED}.
 */
public enum TaskStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED;

    private static final List<TaskStatus> ONGOING = List.of(QUEUED, ACTIVE);

    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case QUEUED -> target == ACTIVE;
            case ACTIVE -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public static List<TaskStatus> ongoing() {
        return ONGOING;
    }
}

package com.example.releaseservice.exception;

import com.example.releaseservice.entity.ReleasePhase;

/**
 * A release phase change that skips a phase or moves backwards.
 */
public class InvalidPhaseTransitionException extends StoreException {

    public InvalidPhaseTransitionException(String releaseName, ReleasePhase current, ReleasePhase target) {
        super(
            "INVALID_PHASE_TRANSITION",
            String.format("Release %s cannot move from %s to %s", releaseName, current, target)
        );
    }
}

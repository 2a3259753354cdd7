package com.example.releaseservice.entity;

import java.util.List;
import java.util.Optional;

/**
 * Release lifecycle, in strict forward order:
 * draft composition, voting, finishing, published.
 */
public enum ReleasePhase {
    RELEASE_CANDIDATE_DRAFT,
    RELEASE_CANDIDATE,
    RELEASE_PREVIEW,
    RELEASE;

    private static final List<ReleasePhase> IN_PROGRESS =
        List.of(RELEASE_CANDIDATE_DRAFT, RELEASE_CANDIDATE, RELEASE_PREVIEW);

    public Optional<ReleasePhase> next() {
        ReleasePhase[] phases = values();
        return ordinal() + 1 < phases.length ? Optional.of(phases[ordinal() + 1]) : Optional.empty();
    }

    /**
     * Only the immediately following phase is reachable.
     */
    public boolean canTransitionTo(ReleasePhase target) {
        return target != null && target.ordinal() == ordinal() + 1;
    }

    public boolean isTerminal() {
        return this == RELEASE;
    }

    public boolean isBefore(ReleasePhase other) {
        return ordinal() < other.ordinal();
    }

    public static List<ReleasePhase> inProgress() {
        return IN_PROGRESS;
    }
}

package com.example.releaseservice.entity.result;

import java.util.List;

/**
 * Outcome counts of a file check run over one revision.
 */
public record CheckSummaryResult(
    int successes,
    int warnings,
    int failures,
    List<String> messages
) implements TaskResult {

    public boolean passed() {
        return failures == 0;
    }
}

package com.example.releaseservice.dto;

import com.example.releaseservice.entity.ReleasePhase;
import com.example.releaseservice.support.UtcTimestamps;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Release row with its latest revision number as of the query.
 */
public record ReleaseSummary(
        String name,
        String projectName,
        String version,
        ReleasePhase phase,
        Instant created,
        Integer latestRevisionNumber
) {

    public Optional<Integer> latestRevision() {
        return Optional.ofNullable(latestRevisionNumber);
    }

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }
}

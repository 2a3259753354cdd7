package com.example.releaseservice.entity;

import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * A version of a project moving through the release phases.
 *
 * <p>The latest revision number is deliberately not a column: it is computed
 * from the revisions table whenever it is read.
 */
@Entity
@Table(name = "releases")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Release extends NaturalKeyEntity {

    @Id
    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "project_name", nullable = false, length = 100, updatable = false)
    private String projectName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_name", insertable = false, updatable = false)
    private Project project;

    @Column(name = "version", nullable = false, length = 100, updatable = false)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 40)
    private ReleasePhase phase;

    @Column(name = "created", nullable = false, updatable = false)
    private Instant created;

    @Column(name = "released")
    private Instant released;

    @Column(name = "podling_thread_id")
    private String podlingThreadId;

    @Override
    public String getId() {
        return name;
    }

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }

    public OffsetDateTime releasedUtc() {
        return UtcTimestamps.denormalize(released);
    }
}

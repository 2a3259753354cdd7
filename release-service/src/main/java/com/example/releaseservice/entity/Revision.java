package com.example.releaseservice.entity;

import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * One immutable iteration of a release's file set. {@code seq} and
 * {@code number} are assigned by the revision allocator and always equal.
 */
@Entity
@Table(name = "revisions")
@Immutable
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Revision extends NaturalKeyEntity {

    @Id
    @Column(name = "name", nullable = false, length = 300)
    private String name;

    @Column(name = "release_name", nullable = false)
    private String releaseName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "release_name", insertable = false, updatable = false)
    private Release release;

    @Column(name = "seq", nullable = false)
    private int seq;

    @Column(name = "number", nullable = false)
    private int number;

    @Column(name = "created", nullable = false)
    private Instant created;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "description", length = 4000)
    private String description;

    /**
     * Name of the revision this one supersedes, null for the first revision.
     */
    @Column(name = "parent_name", length = 300)
    private String parentName;

    @Override
    public String getId() {
        return name;
    }

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }
}

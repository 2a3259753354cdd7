package com.example.releaseservice.entity;

import com.example.releaseservice.support.StringListJsonConverter;
import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A software unit under a committee. Owns releases and, optionally,
 * a release policy.
 */
@Entity
@Table(name = "projects")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project extends NaturalKeyEntity {

    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "category")
    private String category;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "programming_languages", length = 4000)
    @Builder.Default
    private List<String> programmingLanguages = new ArrayList<>();

    @Column(name = "committee_name", nullable = false, length = 100)
    private String committeeName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "committee_name", insertable = false, updatable = false)
    private Committee committee;

    @OneToOne(fetch = FetchType.EAGER, cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "release_policy_id")
    private ReleasePolicy releasePolicy;

    @Column(name = "created", nullable = false, updatable = false)
    private Instant created;

    @Override
    public String getId() {
        return name;
    }

    /**
     * Display name, falling back to the project name.
     */
    public String effectiveDisplayName() {
        return displayName == null || displayName.isBlank() ? name : displayName;
    }

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }
}

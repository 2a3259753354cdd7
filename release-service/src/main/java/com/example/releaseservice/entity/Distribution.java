package com.example.releaseservice.entity;

import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Record of a release published to an external package registry.
 */
@Entity
@Table(name = "distributions")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Distribution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "release_name", nullable = false)
    private String releaseName;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 40)
    private DistributionPlatform platform;

    @Column(name = "owner_namespace", nullable = false)
    private String ownerNamespace;

    @Column(name = "package_name", nullable = false)
    private String packageName;

    @Column(name = "version", nullable = false, length = 100)
    private String version;

    @Column(name = "staging", nullable = false)
    private boolean staging;

    @Column(name = "api_url", nullable = false, length = 2000)
    private String apiUrl;

    @Column(name = "created", nullable = false, updatable = false)
    private Instant created;

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }
}

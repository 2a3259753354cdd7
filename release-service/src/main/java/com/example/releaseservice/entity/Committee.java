package com.example.releaseservice.entity;

import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Organizational body owning projects. A committee with a parent is a
 * podling of that parent.
 */
@Entity
@Table(name = "committees")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Committee extends NaturalKeyEntity {

    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "parent_name", length = 100)
    private String parentName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_name", insertable = false, updatable = false)
    private Committee parent;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "committee_members", joinColumns = @JoinColumn(name = "committee_name"))
    @OrderColumn(name = "list_index")
    @Column(name = "asf_uid", nullable = false)
    @Builder.Default
    private List<String> committeeMembers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "committee_committers", joinColumns = @JoinColumn(name = "committee_name"))
    @OrderColumn(name = "list_index")
    @Column(name = "asf_uid", nullable = false)
    @Builder.Default
    private List<String> committers = new ArrayList<>();

    @Column(name = "created", nullable = false, updatable = false)
    private Instant created;

    @Override
    public String getId() {
        return name;
    }

    public boolean isPodling() {
        return parentName != null;
    }

    public boolean isMember(String asfUid) {
        return committeeMembers.contains(asfUid);
    }

    public boolean isParticipant(String asfUid) {
        return committeeMembers.contains(asfUid) || committers.contains(asfUid);
    }

    public OffsetDateTime createdUtc() {
        return UtcTimestamps.denormalize(created);
    }
}

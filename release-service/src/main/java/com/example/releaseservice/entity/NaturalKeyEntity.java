package com.example.releaseservice.entity;

import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

/**
 * Base for entities whose primary key is a caller-chosen name.
 *
 * <p>Spring Data treats an entity with a non-null id as existing and would
 * merge it over a row with the same key. Tracking newness explicitly makes
 * {@code save} insert, so a duplicate key fails on the primary key instead of
 * silently overwriting.
 */
@MappedSuperclass
public abstract class NaturalKeyEntity implements Persistable<String> {

    @Transient
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.fresh = false;
    }
}

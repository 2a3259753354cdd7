package com.example.releaseservice.service;

import com.example.releaseservice.dto.RevisionAllocation;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.repository.ReleaseRepository;
import com.example.releaseservice.repository.RevisionRepository;
import com.example.releaseservice.support.ReleaseNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assigns the next revision counters of a release.
 *
 * <p>Runs only inside the transaction that inserts the revision. The release
 * row is locked first, so a second writer for the same release waits until
 * the first commits and then reads the new maximum.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevisionAllocator {

    private final ReleaseRepository releaseRepository;
    private final RevisionRepository revisionRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public RevisionAllocation allocate(String releaseName) {
        releaseRepository.findByNameForUpdate(releaseName)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(releaseName));

        Integer maxSeq = revisionRepository.findMaxSeq(releaseName);
        int next = maxSeq == null ? 1 : maxSeq + 1;

        RevisionAllocation allocation = new RevisionAllocation(next, next, ReleaseNames.revision(releaseName, next));
        log.debug("Revision allocated: release={}, seq={}, name={}", releaseName, next, allocation.name());
        return allocation;
    }
}

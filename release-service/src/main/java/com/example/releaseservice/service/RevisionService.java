package com.example.releaseservice.service;

import com.example.releaseservice.config.ResilienceConfig;
import com.example.releaseservice.dto.RevisionAllocation;
import com.example.releaseservice.entity.Release;
import com.example.releaseservice.entity.Revision;
import com.example.releaseservice.exception.AllocationConflictException;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ReleaseImmutableException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.ReleaseRepository;
import com.example.releaseservice.repository.RevisionRepository;
import com.example.releaseservice.support.RevisionKeyCollision;
import com.example.releaseservice.support.UtcTimestamps;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Creates and reads revisions.
 *
 * Creation runs in its own transaction wrapped by the revisionAllocation
 * retry: a unique violation on the revision keys rolls the transaction back
 * and the whole insert is attempted again from a fresh read of the maximum.
 * Any other integrity failure is reported at once.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class RevisionService {

    private final ReleaseRepository releaseRepository;
    private final RevisionRepository revisionRepository;
    private final RevisionAllocator allocator;
    private final TransactionTemplate transactionTemplate;
    private final StoreMetrics metrics;
    private final Retry allocationRetry;

    public RevisionService(ReleaseRepository releaseRepository,
                           RevisionRepository revisionRepository,
                           RevisionAllocator allocator,
                           TransactionTemplate transactionTemplate,
                           StoreMetrics metrics,
                           RetryRegistry retryRegistry) {
        this.releaseRepository = releaseRepository;
        this.revisionRepository = revisionRepository;
        this.allocator = allocator;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.allocationRetry = retryRegistry.retry(ResilienceConfig.REVISION_ALLOCATION);
    }

    /**
     * Appends a revision to a release that has not been published.
     *
     * @throws ReleaseImmutableException when the release is in RELEASE
     * @throws AllocationConflictException when every attempt collided on the sequence
     * @throws ConstraintViolationException when the row breaks any other constraint
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Revision createRevision(String releaseName, String createdBy, String description) {
        try {
            Revision revision = Retry.decorateSupplier(allocationRetry,
                    () -> transactionTemplate.execute(status -> appendRevision(releaseName, createdBy, description))
            ).get();
            log.info("Revision created: name={}, seq={}, createdBy={}", revision.getName(), revision.getSeq(), createdBy);
            return revision;
        } catch (DataIntegrityViolationException ex) {
            if (!RevisionKeyCollision.matches(ex)) {
                metrics.recordConstraintViolation();
                log.warn("Revision rejected by database: release={}, error={}",
                        releaseName, ex.getMostSpecificCause().getMessage());
                throw ConstraintViolationException.integrity("revision", ex);
            }
            metrics.recordAllocationConflict();
            log.warn("Revision allocation exhausted: release={}, attempts={}",
                    releaseName, allocationRetry.getRetryConfig().getMaxAttempts());
            throw new AllocationConflictException(
                    releaseName, allocationRetry.getRetryConfig().getMaxAttempts(), ex);
        }
    }

    /**
     * Appends a revision inside the caller's transaction. The release row is
     * locked for the rest of that transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Revision appendRevision(String releaseName, String createdBy, String description) {
        Release release = releaseRepository.findByNameForUpdate(releaseName)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(releaseName));
        if (release.getPhase().isTerminal()) {
            log.warn("Revision rejected, release is published: release={}", releaseName);
            throw new ReleaseImmutableException(releaseName, "create a revision");
        }

        Optional<Revision> parent = revisionRepository.findFirstByReleaseNameOrderBySeqDesc(releaseName);
        RevisionAllocation allocation = allocator.allocate(releaseName);

        Revision revision = Revision.builder()
                .name(allocation.name())
                .releaseName(releaseName)
                .seq(allocation.seq())
                .number(allocation.number())
                .created(UtcTimestamps.now())
                .createdBy(createdBy)
                .description(description)
                .parentName(parent.map(Revision::getName).orElse(null))
                .build();

        Revision saved = revisionRepository.saveAndFlush(revision);
        metrics.recordRevisionCreated();
        return saved;
    }

    public List<Revision> listRevisions(String releaseName) {
        return revisionRepository.findByReleaseNameOrderBySeqAsc(releaseName);
    }

    public Revision getRevision(String releaseName, int number) {
        return revisionRepository.findByReleaseNameAndNumber(releaseName, number)
                .orElseThrow(() -> ResourceNotFoundException.revisionNotFound(releaseName, number));
    }

    public Optional<Revision> latestRevision(String releaseName) {
        return revisionRepository.findFirstByReleaseNameOrderBySeqDesc(releaseName);
    }

    /**
     * Aggregated from the revisions table at query time.
     */
    public Optional<Integer> latestRevisionNumber(String releaseName) {
        return Optional.ofNullable(revisionRepository.findMaxNumber(releaseName));
    }
}

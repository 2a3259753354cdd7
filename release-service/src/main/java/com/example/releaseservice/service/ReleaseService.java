package com.example.releaseservice.service;

import com.example.releaseservice.dto.ReleaseSummary;
import com.example.releaseservice.entity.Release;
import com.example.releaseservice.entity.ReleasePhase;
import com.example.releaseservice.entity.Revision;
import com.example.releaseservice.entity.TaskStatus;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.InvalidPhaseTransitionException;
import com.example.releaseservice.exception.ReleaseImmutableException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.ProjectRepository;
import com.example.releaseservice.repository.ReleaseRepository;
import com.example.releaseservice.repository.RevisionRepository;
import com.example.releaseservice.repository.TaskRepository;
import com.example.releaseservice.support.ReleaseNames;
import com.example.releaseservice.support.ReleaseVersionComparator;
import com.example.releaseservice.support.UtcTimestamps;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Release lifecycle and release queries.
 *
 * Every phase change locks the release row, checks the current phase under
 * the lock and writes the new phase in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Validated
@Transactional(readOnly = true)
public class ReleaseService {

    private final ReleaseRepository releaseRepository;
    private final ProjectRepository projectRepository;
    private final RevisionRepository revisionRepository;
    private final TaskRepository taskRepository;
    private final RevisionService revisionService;
    private final StoreMetrics metrics;

    /**
     * Creates a release in RELEASE_CANDIDATE_DRAFT.
     *
     * @param name release name, derived from project and version when null
     * @throws ConstraintViolationException when the project already has this version
     *         or another release already uses the name
     */
    @Transactional
    public Release createRelease(@NotBlank String projectName, @NotBlank @Size(max = 100) String version, String name) {
        log.info("Creating release: project={}, version={}", projectName, version);

        if (!projectRepository.existsById(projectName)) {
            throw ResourceNotFoundException.projectNotFound(projectName);
        }
        if (releaseRepository.existsByProjectNameAndVersion(projectName, version)) {
            metrics.recordConstraintViolation();
            log.warn("Release rejected, version exists: project={}, version={}", projectName, version);
            throw ConstraintViolationException.releaseExists(projectName, version);
        }

        String releaseName = name != null ? name : ReleaseNames.release(projectName, version);
        if (releaseRepository.existsById(releaseName)) {
            metrics.recordConstraintViolation();
            log.warn("Release rejected, name taken: project={}, version={}, name={}", projectName, version, releaseName);
            throw ConstraintViolationException.releaseNameTaken(releaseName);
        }

        Release release = Release.builder()
                .name(releaseName)
                .projectName(projectName)
                .version(version)
                .phase(ReleasePhase.RELEASE_CANDIDATE_DRAFT)
                .created(UtcTimestamps.now())
                .build();

        try {
            Release saved = releaseRepository.saveAndFlush(release);
            metrics.recordPhaseTransition(ReleasePhase.RELEASE_CANDIDATE_DRAFT);
            log.info("Release created successfully: name={}", saved.getName());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            log.warn("Release rejected by database: project={}, version={}, error={}",
                    projectName, version, ex.getMostSpecificCause().getMessage());
            throw ConstraintViolationException.integrity("release", ex);
        }
    }

    @Transactional
    public Release createRelease(@NotBlank String projectName, @NotBlank @Size(max = 100) String version) {
        return createRelease(projectName, version, null);
    }

    public Release getRelease(String name) {
        return releaseRepository.findById(name)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(name));
    }

    public Optional<Release> findRelease(String projectName, String version) {
        return releaseRepository.findByProjectNameAndVersion(projectName, version);
    }

    public List<Release> releasesByPhase(String projectName, ReleasePhase phase) {
        return releaseRepository.findByProjectNameAndPhaseOrderByCreatedDesc(projectName, phase);
    }

    /**
     * Releases in draft, candidate or preview, newest first.
     */
    public List<Release> releasesInProgress(String projectName) {
        return releaseRepository.findByProjectNameAndPhaseInOrderByCreatedDesc(projectName, ReleasePhase.inProgress());
    }

    /**
     * All releases of the project, highest version first.
     */
    public List<Release> allReleases(String projectName) {
        Comparator<Release> byVersion = Comparator.comparing(Release::getVersion, ReleaseVersionComparator.INSTANCE);
        return releaseRepository.findByProjectName(projectName).stream()
                .sorted(byVersion.reversed())
                .toList();
    }

    /**
     * Releases with their latest revision number, read in one statement.
     */
    public List<ReleaseSummary> releaseSummaries(String projectName) {
        return releaseRepository.findSummariesByProjectName(projectName);
    }

    public Optional<Integer> latestRevisionNumber(String releaseName) {
        return revisionService.latestRevisionNumber(releaseName);
    }

    /**
     * Moves the release one phase forward. Reaching RELEASE stamps the
     * release time when none is set.
     *
     * @throws InvalidPhaseTransitionException when target is not the next phase
     */
    @Transactional
    public Release transitionPhase(String releaseName, ReleasePhase target) {
        Release release = lock(releaseName);
        return advance(release, target);
    }

    /**
     * Starts the vote on the selected revision, which must be the latest one
     * and must have no queued or active tasks.
     */
    @Transactional
    public Release startVote(String releaseName, @Positive int selectedRevisionNumber) {
        Release release = lock(releaseName);
        requirePhase(release, ReleasePhase.RELEASE_CANDIDATE_DRAFT, ReleasePhase.RELEASE_CANDIDATE);

        Integer latest = revisionRepository.findMaxNumber(releaseName);
        if (latest == null || latest != selectedRevisionNumber) {
            metrics.recordConstraintViolation();
            log.warn("Vote rejected, revision not latest: release={}, selected={}, latest={}",
                    releaseName, selectedRevisionNumber, latest);
            throw ConstraintViolationException.revisionNotLatest(releaseName, selectedRevisionNumber, latest);
        }

        long ongoing = taskRepository.countByProjectNameAndVersionNameAndRevisionNumberAndStatusIn(
                release.getProjectName(), release.getVersion(), selectedRevisionNumber, TaskStatus.ongoing());
        if (ongoing > 0) {
            metrics.recordConstraintViolation();
            log.warn("Vote rejected, tasks ongoing: release={}, revision={}, ongoing={}",
                    releaseName, selectedRevisionNumber, ongoing);
            throw ConstraintViolationException.tasksOngoing(releaseName, selectedRevisionNumber, ongoing);
        }

        return advance(release, ReleasePhase.RELEASE_CANDIDATE);
    }

    /**
     * Moves a candidate to preview and records the preview revision in the
     * same transaction.
     */
    @Transactional
    public Release markVotePassed(String releaseName, String asfUid) {
        Release release = lock(releaseName);
        requirePhase(release, ReleasePhase.RELEASE_CANDIDATE, ReleasePhase.RELEASE_PREVIEW);

        Optional<Integer> candidate = Optional.ofNullable(revisionRepository.findMaxNumber(releaseName));
        Release advanced = advance(release, ReleasePhase.RELEASE_PREVIEW);

        String description = candidate
                .map(number -> "Preview of candidate revision " + number)
                .orElse("Preview after passed vote");
        Revision preview = revisionService.appendRevision(releaseName, asfUid, description);
        log.info("Preview revision created: release={}, revision={}", releaseName, preview.getName());
        return advanced;
    }

    /**
     * Publishes a preview.
     *
     * @param releasedAt release time in any zone, null for now
     */
    @Transactional
    public Release publish(String releaseName, OffsetDateTime releasedAt) {
        Release release = lock(releaseName);
        requirePhase(release, ReleasePhase.RELEASE_PREVIEW, ReleasePhase.RELEASE);

        Instant released = releasedAt == null ? UtcTimestamps.now() : UtcTimestamps.normalize(releasedAt);
        release.setReleased(released);
        return advance(release, ReleasePhase.RELEASE);
    }

    /**
     * Deletes an unpublished release with its revisions, tasks and distributions.
     *
     * @throws ReleaseImmutableException when the release is published
     */
    @Transactional
    public void deleteRelease(String releaseName) {
        Release release = lock(releaseName);
        if (release.getPhase().isTerminal()) {
            log.warn("Delete rejected, release is published: release={}", releaseName);
            throw new ReleaseImmutableException(releaseName, "delete");
        }

        int tasks = taskRepository.deleteByRelease(release.getProjectName(), release.getVersion());
        releaseRepository.delete(release);
        releaseRepository.flush();
        log.info("Release deleted: name={}, tasksDeleted={}", releaseName, tasks);
    }

    private Release lock(String releaseName) {
        return releaseRepository.findByNameForUpdate(releaseName)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(releaseName));
    }

    private void requirePhase(Release release, ReleasePhase expected, ReleasePhase target) {
        if (release.getPhase() != expected) {
            log.warn("Phase transition rejected: release={}, from={}, to={}",
                    release.getName(), release.getPhase(), target);
            throw new InvalidPhaseTransitionException(release.getName(), release.getPhase(), target);
        }
    }

    private Release advance(Release release, ReleasePhase target) {
        ReleasePhase current = release.getPhase();
        if (!current.canTransitionTo(target)) {
            log.warn("Phase transition rejected: release={}, from={}, to={}", release.getName(), current, target);
            throw new InvalidPhaseTransitionException(release.getName(), current, target);
        }

        release.setPhase(target);
        if (target == ReleasePhase.RELEASE && release.getReleased() == null) {
            release.setReleased(UtcTimestamps.now());
        }

        try {
            releaseRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.integrity("release " + release.getName(), ex);
        }

        metrics.recordPhaseTransition(target);
        log.info("Release phase changed: name={}, from={}, to={}", release.getName(), current, target);
        return release;
    }
}

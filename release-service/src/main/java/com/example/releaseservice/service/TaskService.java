package com.example.releaseservice.service;

import com.example.releaseservice.dto.NewTask;
import com.example.releaseservice.entity.Release;
import com.example.releaseservice.entity.Task;
import com.example.releaseservice.entity.TaskStatus;
import com.example.releaseservice.entity.TaskType;
import com.example.releaseservice.entity.result.TaskResult;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.InvalidTransitionException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.ReleaseRepository;
import com.example.releaseservice.repository.RevisionRepository;
import com.example.releaseservice.repository.TaskRepository;
import com.example.releaseservice.support.TaskResultCodec;
import com.example.releaseservice.support.UtcTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task queue and task status lifecycle.
 *
 * Status changes are single conditional UPDATE statements. When no row
 * matches, the task is re-read to report whether it is missing or in the
 * wrong status; the row itself is never touched.
 */
@Service
@Slf4j
@Validated
@Transactional(readOnly = true)
public class TaskService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final TaskRepository taskRepository;
    private final ReleaseRepository releaseRepository;
    private final RevisionRepository revisionRepository;
    private final TaskResultCodec resultCodec;
    private final ObjectMapper objectMapper;
    private final StoreMetrics metrics;

    @Value("${release-store.tasks.claim-attempts:3}")
    private int claimAttempts;

    public TaskService(TaskRepository taskRepository,
                       ReleaseRepository releaseRepository,
                       RevisionRepository revisionRepository,
                       TaskResultCodec resultCodec,
                       ObjectMapper objectMapper,
                       StoreMetrics metrics) {
        this.taskRepository = taskRepository;
        this.releaseRepository = releaseRepository;
        this.revisionRepository = revisionRepository;
        this.resultCodec = resultCodec;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Transactional
    public Task enqueue(@Valid NewTask request) {
        Task task = Task.builder()
                .taskType(request.taskType())
                .status(TaskStatus.QUEUED)
                .taskArgs(encodeArgs(request.taskType(), request.taskArgs()))
                .added(UtcTimestamps.now())
                .scheduled(request.scheduled() == null ? null : UtcTimestamps.normalize(request.scheduled()))
                .asfUid(request.asfUid())
                .projectName(request.projectName())
                .versionName(request.versionName())
                .revisionNumber(request.revisionNumber())
                .build();

        try {
            Task saved = taskRepository.saveAndFlush(task);
            metrics.recordTaskTransition(TaskStatus.QUEUED);
            log.info("Task enqueued: id={}, type={}, project={}, version={}",
                    saved.getId(), saved.getTaskType(), saved.getProjectName(), saved.getVersionName());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.integrity("task", ex);
        }
    }

    /**
     * QUEUED → ACTIVE.
     *
     * @throws InvalidTransitionException when the task is not QUEUED
     */
    @Transactional
    public Task markActive(Long taskId, int pid) {
        int updated = taskRepository.activateIfQueued(taskId, pid, UtcTimestamps.now());
        if (updated == 0) {
            throw rejected(taskId, TaskStatus.ACTIVE);
        }
        metrics.recordTaskTransition(TaskStatus.ACTIVE);
        log.info("Task started: id={}, pid={}", taskId, pid);
        return getTask(taskId);
    }

    /**
     * ACTIVE → COMPLETED. The result is encoded with the shape registered
     * for the task's type before anything is written. A task that is already
     * out of ACTIVE is rejected before its result is looked at.
     *
     * @throws InvalidTransitionException when the task is not ACTIVE
     */
    @Transactional
    public Task markCompleted(Long taskId, TaskResult result) {
        Task task = getTask(taskId);
        if (!task.getStatus().canTransitionTo(TaskStatus.COMPLETED)) {
            throw rejected(task, TaskStatus.COMPLETED);
        }
        String encoded = resultCodec.encode(task.getTaskType(), result);
        return finish(taskId, TaskStatus.COMPLETED, encoded, null);
    }

    /**
     * ACTIVE → FAILED.
     *
     * @throws InvalidTransitionException when the task is not ACTIVE
     */
    @Transactional
    public Task markFailed(Long taskId, String error) {
        String message = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
        return finish(taskId, TaskStatus.FAILED, null, message);
    }

    /**
     * Claims the oldest queued task whose scheduled time has arrived.
     * A task taken by another worker between the read and the update is
     * skipped; the next candidate is tried.
     */
    @Transactional
    public Optional<Task> claimNext(int pid) {
        Instant now = UtcTimestamps.now();
        List<Long> candidates = taskRepository.findDueQueuedIds(now, PageRequest.of(0, claimAttempts));
        for (Long id : candidates) {
            if (taskRepository.activateIfQueued(id, pid, now) == 1) {
                metrics.recordTaskTransition(TaskStatus.ACTIVE);
                log.info("Task claimed: id={}, pid={}", id, pid);
                return Optional.of(getTask(id));
            }
            log.debug("Task already claimed by another worker: id={}", id);
        }
        return Optional.empty();
    }

    public Task getTask(Long taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> ResourceNotFoundException.taskNotFound(taskId));
    }

    public TaskResult decodeResult(Task task) {
        return resultCodec.decode(task.getTaskType(), task.getResult());
    }

    public List<Task> findForRelease(String projectName, String versionName) {
        return taskRepository.findByProjectNameAndVersionNameOrderByAddedDesc(projectName, versionName);
    }

    /**
     * Queued and active tasks for a revision of the release.
     *
     * @param revisionNumber revision to count for, null for the latest revision
     * @return zero when the latest revision is asked for and the release is
     *         missing or has no revisions
     */
    public long countOngoing(String projectName, String versionName, Integer revisionNumber) {
        Integer revision = revisionNumber;
        if (revision == null) {
            revision = releaseRepository.findByProjectNameAndVersion(projectName, versionName)
                    .map(release -> revisionRepository.findMaxNumber(release.getName()))
                    .orElse(null);
            if (revision == null) {
                return 0;
            }
        }
        return taskRepository.countByProjectNameAndVersionNameAndRevisionNumberAndStatusIn(
                projectName, versionName, revision, TaskStatus.ongoing());
    }

    /**
     * Most recently added vote initiation task of the release that has
     * finished with a result.
     */
    public Optional<Task> latestVoteTask(String projectName, String versionName) {
        return taskRepository.findFinishedWithResult(
                projectName, versionName, TaskType.VOTE_INITIATE, TaskStatus.ongoing(), PageRequest.of(0, 1)
        ).stream().findFirst();
    }

    public Optional<Task> latestVoteTask(String releaseName) {
        Release release = releaseRepository.findById(releaseName)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(releaseName));
        return latestVoteTask(release.getProjectName(), release.getVersion());
    }

    private Task finish(Long taskId, TaskStatus target, String result, String error) {
        int updated = taskRepository.finishIfActive(taskId, target, UtcTimestamps.now(), result, error);
        if (updated == 0) {
            throw rejected(taskId, target);
        }
        metrics.recordTaskTransition(target);
        log.info("Task finished: id={}, status={}", taskId, target);
        return getTask(taskId);
    }

    private RuntimeException rejected(Long taskId, TaskStatus target) {
        return rejected(getTask(taskId), target);
    }

    private RuntimeException rejected(Task current, TaskStatus target) {
        log.warn("Task transition rejected: id={}, from={}, to={}", current.getId(), current.getStatus(), target);
        return InvalidTransitionException.task(current.getId(), current.getStatus(), target);
    }

    private String encodeArgs(TaskType taskType, Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(args == null ? Map.of() : args);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Arguments of task type " + taskType + " are not serializable", ex);
        }
    }
}

package com.example.releaseservice.service;

import com.example.releaseservice.StoreIntegrationTestBase;
import com.example.releaseservice.dto.NewTask;
import com.example.releaseservice.entity.Task;
import com.example.releaseservice.entity.TaskStatus;
import com.example.releaseservice.entity.TaskType;
import com.example.releaseservice.entity.result.CheckSummaryResult;
import com.example.releaseservice.entity.result.SbomGenerateResult;
import com.example.releaseservice.entity.result.VoteInitiateResult;
import com.example.releaseservice.exception.InvalidTransitionException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.exception.UnknownResultShapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskServiceIntegrationTest extends StoreIntegrationTestBase {

    private static final String VERSION = "1.0.0";

    @Autowired
    private TaskService taskService;

    @Autowired
    private RevisionService revisionService;

    private String releaseName;

    @BeforeEach
    void setUp() {
        givenProject();
        releaseName = givenDraftRelease(VERSION);
    }

    @Test
    void testLifecycle_QueuedActiveCompleted_AllTimestampsAndPidSet() {
        // GIVEN
        Task queued = taskService.enqueue(checkTask(1));
        assertThat(queued.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(queued.getAdded()).isNotNull();

        // WHEN
        taskService.markActive(queued.getId(), 4242);
        Task completed = taskService.markCompleted(queued.getId(),
                new CheckSummaryResult(3, 1, 0, List.of("LICENSE present")));

        // THEN
        assertThat(completed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(completed.getStarted()).isNotNull();
        assertThat(completed.getPid()).isEqualTo(4242);
        assertThat(completed.getCompleted()).isNotNull();
        assertThat(completed.completedUtc().getOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(taskService.decodeResult(completed))
                .isEqualTo(new CheckSummaryResult(3, 1, 0, List.of("LICENSE present")));
    }

    @Test
    void testMarkCompleted_QueuedTask_InvalidTransitionRowUnchanged() {
        Task queued = taskService.enqueue(checkTask(1));

        assertThatThrownBy(() -> taskService.markCompleted(queued.getId(),
                new CheckSummaryResult(1, 0, 0, List.of())))
                .isInstanceOf(InvalidTransitionException.class);

        Task reloaded = taskService.getTask(queued.getId());
        assertThat(reloaded.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(reloaded.getCompleted()).isNull();
        assertThat(reloaded.getResult()).isNull();
    }

    @Test
    void testMarkActive_Twice_SecondCallRejected() {
        Task queued = taskService.enqueue(checkTask(1));
        taskService.markActive(queued.getId(), 1);

        assertThatThrownBy(() -> taskService.markActive(queued.getId(), 2))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(taskService.getTask(queued.getId()).getPid()).isEqualTo(1);
    }

    @Test
    void testMarkFailed_ActiveTask_StoresErrorWithoutResult() {
        Task queued = taskService.enqueue(checkTask(1));
        taskService.markActive(queued.getId(), 7);

        Task failed = taskService.markFailed(queued.getId(), "signature file missing");

        assertThat(failed.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("signature file missing");
        assertThat(failed.getResult()).isNull();
        assertThat(taskService.decodeResult(failed)).isNull();
    }

    @Test
    void testMarkCompleted_ResultOfWrongShape_RejectedBeforeWrite() {
        Task queued = taskService.enqueue(checkTask(1));
        taskService.markActive(queued.getId(), 7);

        assertThatThrownBy(() -> taskService.markCompleted(queued.getId(), new SbomGenerateResult("done", "a.cdx.json")))
                .isInstanceOf(UnknownResultShapeException.class);
        assertThat(taskService.getTask(queued.getId()).getStatus()).isEqualTo(TaskStatus.ACTIVE);
    }

    @Test
    void testMarkCompleted_AlreadyFailed_TransitionRejectedBeforeResultChecked() {
        // GIVEN
        Task task = taskService.enqueue(checkTask(1));
        taskService.markActive(task.getId(), 7);
        taskService.markFailed(task.getId(), "worker crashed");

        // WHEN / THEN: a result of the wrong shape still reports the status problem
        assertThatThrownBy(() -> taskService.markCompleted(task.getId(), new SbomGenerateResult("done", "a.cdx.json")))
                .isInstanceOf(InvalidTransitionException.class);
        Task reloaded = taskService.getTask(task.getId());
        assertThat(reloaded.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(reloaded.getResult()).isNull();
    }

    @Test
    void testEnqueue_MissingTypeOrBadRevision_RejectedByValidation() {
        assertThatThrownBy(() -> taskService.enqueue(NewTask.builder().projectName(PROJECT).build()))
                .isInstanceOf(jakarta.validation.ConstraintViolationException.class);
        assertThatThrownBy(() -> taskService.enqueue(NewTask.builder()
                .taskType(TaskType.HASHING_CHECK)
                .revisionNumber(0)
                .build()))
                .isInstanceOf(jakarta.validation.ConstraintViolationException.class);
        assertThat(taskService.findForRelease(PROJECT, VERSION)).isEmpty();
    }

    @Test
    void testMarkActive_UnknownTask_NotFound() {
        assertThatThrownBy(() -> taskService.markActive(999_999L, 1))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testStatusCheck_DirectUpdateToActiveWithoutPid_RejectedByDatabase() {
        Task queued = taskService.enqueue(checkTask(1));

        assertThatThrownBy(() -> jdbcTemplate.update("UPDATE tasks SET status = 'ACTIVE' WHERE id = ?", queued.getId()))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThatThrownBy(() -> jdbcTemplate.update(
                "UPDATE tasks SET status = 'COMPLETED', completed = NULL WHERE id = ?", queued.getId()))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(taskService.getTask(queued.getId()).getStatus()).isEqualTo(TaskStatus.QUEUED);
    }

    @Test
    void testClaimNext_SkipsFutureScheduledTasks_OldestFirst() {
        Task later = taskService.enqueue(NewTask.builder()
                .taskType(TaskType.SVN_IMPORT_FILES)
                .scheduled(OffsetDateTime.now(ZoneOffset.ofHours(-7)).plusHours(1))
                .build());
        Task first = taskService.enqueue(checkTask(1));
        Task second = taskService.enqueue(checkTask(1));

        assertThat(taskService.claimNext(11)).get().extracting(Task::getId).isEqualTo(first.getId());
        assertThat(taskService.claimNext(12)).get().extracting(Task::getId).isEqualTo(second.getId());
        assertThat(taskService.claimNext(13)).isEmpty();
        assertThat(taskService.getTask(later.getId()).getStatus()).isEqualTo(TaskStatus.QUEUED);
    }

    @Test
    void testClaimNext_ConcurrentWorkers_NoTaskHandedOutTwice() throws Exception {
        // GIVEN: more workers than tasks
        int tasks = 5;
        int workers = 8;
        for (int i = 0; i < tasks; i++) {
            taskService.enqueue(checkTask(1));
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            int pid = 100 + w;
            futures.add(executor.submit(() -> {
                start.await();
                List<Long> claimed = new ArrayList<>();
                Optional<Task> task;
                while ((task = taskService.claimNext(pid)).isPresent()) {
                    claimed.add(task.get().getId());
                }
                return claimed;
            }));
        }

        // WHEN
        start.countDown();
        List<Long> allClaimed = Collections.synchronizedList(new ArrayList<>());
        for (Future<List<Long>> future : futures) {
            allClaimed.addAll(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // THEN
        assertThat(allClaimed).hasSize(tasks).doesNotHaveDuplicates();
    }

    @Test
    void testCountOngoing_DefaultsToLatestRevision() {
        revisionService.createRevision(releaseName, "alice", null);
        revisionService.createRevision(releaseName, "alice", null);
        taskService.enqueue(checkTask(1));
        Task active = taskService.enqueue(checkTask(2));
        taskService.enqueue(checkTask(2));
        taskService.markActive(active.getId(), 5);

        assertThat(taskService.countOngoing(PROJECT, VERSION, null)).isEqualTo(2);
        assertThat(taskService.countOngoing(PROJECT, VERSION, 1)).isEqualTo(1);

        taskService.markCompleted(active.getId(), new CheckSummaryResult(1, 0, 0, List.of()));
        assertThat(taskService.countOngoing(PROJECT, VERSION, null)).isEqualTo(1);
    }

    @Test
    void testCountOngoing_NoRevisions_Zero() {
        taskService.enqueue(checkTask(null));

        assertThat(taskService.countOngoing(PROJECT, VERSION, null)).isZero();
    }

    @Test
    void testCountOngoing_ExplicitlyNamedRelease_LatestRevisionFound() {
        // GIVEN: a release whose name is not derived from project and version
        String customName = releaseService.createRelease(PROJECT, "2.0.0", "custom-name").getName();
        revisionService.createRevision(customName, "alice", null);
        taskService.enqueue(NewTask.builder()
                .taskType(TaskType.SIGNATURE_CHECK)
                .taskArgs(Map.of("primary_rel_path", "apache-tooling-2.0.0.tar.gz.asc"))
                .asfUid("alice")
                .projectName(PROJECT)
                .versionName("2.0.0")
                .revisionNumber(1)
                .build());

        // WHEN / THEN
        assertThat(taskService.countOngoing(PROJECT, "2.0.0", 1)).isEqualTo(1);
        assertThat(taskService.countOngoing(PROJECT, "2.0.0", null)).isEqualTo(1);
    }

    @Test
    void testLatestVoteTask_OnlyFinishedTasksWithResult() {
        // GIVEN: one finished vote, one newer vote still queued
        Task finished = taskService.enqueue(voteTask());
        taskService.markActive(finished.getId(), 1);
        VoteInitiateResult result = new VoteInitiateResult("sent", "dev@tooling.apache.org",
                Instant.parse("2025-03-04T10:00:00Z"), "[VOTE] Release 1.0.0", "<mid@apache.org>", List.of());
        taskService.markCompleted(finished.getId(), result);
        taskService.enqueue(voteTask());

        // WHEN
        Optional<Task> latest = taskService.latestVoteTask(releaseName);

        // THEN
        assertThat(latest).get().extracting(Task::getId).isEqualTo(finished.getId());
        assertThat(taskService.decodeResult(latest.get())).isEqualTo(result);
        assertThat(taskService.findForRelease(PROJECT, VERSION)).hasSize(2);
    }

    private NewTask checkTask(Integer revisionNumber) {
        return NewTask.builder()
                .taskType(TaskType.SIGNATURE_CHECK)
                .taskArgs(Map.of("primary_rel_path", "apache-tooling-1.0.0.tar.gz.asc"))
                .asfUid("alice")
                .projectName(PROJECT)
                .versionName(VERSION)
                .revisionNumber(revisionNumber)
                .build();
    }

    private NewTask voteTask() {
        return NewTask.builder()
                .taskType(TaskType.VOTE_INITIATE)
                .taskArgs(Map.of("release_name", releaseName, "email_to", "dev@tooling.apache.org"))
                .asfUid("alice")
                .projectName(PROJECT)
                .versionName(VERSION)
                .build();
    }
}

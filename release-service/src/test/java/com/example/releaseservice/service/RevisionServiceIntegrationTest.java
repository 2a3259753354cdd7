package com.example.releaseservice.service;

import com.example.releaseservice.StoreIntegrationTestBase;
import com.example.releaseservice.entity.ReleasePhase;
import com.example.releaseservice.entity.Revision;
import com.example.releaseservice.exception.AllocationConflictException;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ReleaseImmutableException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevisionServiceIntegrationTest extends StoreIntegrationTestBase {

    @Autowired
    private RevisionService revisionService;

    private String releaseName;

    @BeforeEach
    void setUp() {
        givenProject();
        releaseName = givenDraftRelease("1.0.0");
    }

    @Test
    void testSequentialRevisions_ContiguousFromOne_NamedAndLinked() {
        // WHEN: five revisions are created one after another
        for (int i = 0; i < 5; i++) {
            revisionService.createRevision(releaseName, "alice", "upload " + i);
        }

        // THEN: seq and number are 1..5, names derive from the release, each links to its predecessor
        List<Revision> revisions = revisionService.listRevisions(releaseName);
        assertThat(revisions).extracting(Revision::getSeq).containsExactly(1, 2, 3, 4, 5);
        assertThat(revisions).allSatisfy(revision -> assertThat(revision.getNumber()).isEqualTo(revision.getSeq()));
        assertThat(revisions.get(0).getName()).isEqualTo(releaseName + "-1");
        assertThat(revisions.get(0).getParentName()).isNull();
        assertThat(revisions.get(3).getParentName()).isEqualTo(releaseName + "-3");
        assertThat(revisions.get(4).createdUtc().getOffset().getTotalSeconds()).isZero();
    }

    @Test
    void testCreateRevision_CreatorTooLong_RejectedOnceAsIntegrityError() {
        // GIVEN
        revisionService.createRevision(releaseName, "alice", "first");

        // WHEN / THEN: the column width is not a sequence collision, so nothing is retried
        assertThatThrownBy(() -> revisionService.createRevision(releaseName, "x".repeat(101), "too long"))
                .isInstanceOf(ConstraintViolationException.class)
                .isNotInstanceOf(AllocationConflictException.class)
                .extracting("code").isEqualTo("DATA_INTEGRITY_ERROR");

        // THEN: the failed insert left no row and did not consume a number
        assertThat(revisionService.listRevisions(releaseName)).hasSize(1);
        assertThat(revisionService.createRevision(releaseName, "alice", "second").getSeq()).isEqualTo(2);
    }

    @Test
    void testConcurrentRevisions_EveryWriterLandsOnNextFreeNumber() throws Exception {
        // GIVEN: eight writers released at the same moment
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Revision>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String uid = "writer" + i;
            futures.add(executor.submit(() -> {
                start.await();
                return revisionService.createRevision(releaseName, uid, "concurrent upload");
            }));
        }

        // WHEN
        start.countDown();
        for (Future<Revision> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // THEN: no gaps, no duplicates
        assertThat(revisionService.listRevisions(releaseName))
                .extracting(Revision::getSeq)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, writers).boxed().toList());
        Integer duplicates = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM (SELECT seq FROM revisions WHERE release_name = ? GROUP BY seq HAVING COUNT(*) > 1) d",
                Integer.class, releaseName);
        assertThat(duplicates).isZero();
    }

    @Test
    void testLatestRevisionNumber_AbsentWithoutRevisions_TracksMaxAfterEachInsert() {
        assertThat(revisionService.latestRevisionNumber(releaseName)).isEmpty();

        for (int expected = 1; expected <= 3; expected++) {
            revisionService.createRevision(releaseName, "alice", null);
            assertThat(revisionService.latestRevisionNumber(releaseName)).contains(expected);
        }
        assertThat(revisionService.latestRevision(releaseName))
                .get()
                .extracting(Revision::getName)
                .isEqualTo(releaseName + "-3");
    }

    @Test
    void testCreateRevision_PublishedRelease_RejectedWithoutInsert() {
        // GIVEN: a release walked all the way to RELEASE
        revisionService.createRevision(releaseName, "alice", null);
        releaseService.transitionPhase(releaseName, ReleasePhase.RELEASE_CANDIDATE);
        releaseService.transitionPhase(releaseName, ReleasePhase.RELEASE_PREVIEW);
        releaseService.transitionPhase(releaseName, ReleasePhase.RELEASE);

        // WHEN / THEN
        assertThatThrownBy(() -> revisionService.createRevision(releaseName, "alice", "late fix"))
                .isInstanceOf(ReleaseImmutableException.class);
        assertThat(revisionService.listRevisions(releaseName)).hasSize(1);
    }

    @Test
    void testGetRevision_UnknownNumber_NotFound() {
        revisionService.createRevision(releaseName, "alice", null);

        assertThat(revisionService.getRevision(releaseName, 1).getCreatedBy()).isEqualTo("alice");
        assertThatThrownBy(() -> revisionService.getRevision(releaseName, 2))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testCreateRevision_UnknownRelease_NotFound() {
        assertThatThrownBy(() -> revisionService.createRevision("missing-1.0", "alice", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}

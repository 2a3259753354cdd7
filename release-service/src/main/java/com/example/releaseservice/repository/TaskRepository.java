package com.example.releaseservice.repository;

import com.example.releaseservice.entity.Task;
import com.example.releaseservice.entity.TaskStatus;
import com.example.releaseservice.entity.TaskType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for Task entity.
 *
 * Status changes are conditional updates: the WHERE clause names the status
 * the task must currently have, so a row that has moved on is left untouched
 * and the caller sees zero affected rows.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Task t SET t.status = com.example.releaseservice.entity.TaskStatus.ACTIVE, " +
            "t.started = :started, t.pid = :pid " +
            "WHERE t.id = :id AND t.status = com.example.releaseservice.entity.TaskStatus.QUEUED")
    int activateIfQueued(@Param("id") Long id, @Param("pid") int pid, @Param("started") Instant started);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Task t SET t.status = :status, t.completed = :completed, " +
            "t.result = :result, t.error = :error " +
            "WHERE t.id = :id AND t.status = com.example.releaseservice.entity.TaskStatus.ACTIVE")
    int finishIfActive(@Param("id") Long id,
                       @Param("status") TaskStatus status,
                       @Param("completed") Instant completed,
                       @Param("result") String result,
                       @Param("error") String error);

    /**
     * Oldest queued tasks that are due, candidates for claiming.
     */
    @Query("SELECT t.id FROM Task t WHERE t.status = com.example.releaseservice.entity.TaskStatus.QUEUED " +
            "AND (t.scheduled IS NULL OR t.scheduled <= :now) ORDER BY t.added ASC, t.id ASC")
    List<Long> findDueQueuedIds(@Param("now") Instant now, Pageable pageable);

    List<Task> findByProjectNameAndVersionNameOrderByAddedDesc(String projectName, String versionName);

    long countByProjectNameAndVersionNameAndRevisionNumberAndStatusIn(
            String projectName, String versionName, Integer revisionNumber, Collection<TaskStatus> statuses);

    @Query("SELECT t FROM Task t WHERE t.projectName = :projectName AND t.versionName = :versionName " +
            "AND t.taskType = :taskType AND t.status NOT IN :excluded AND t.result IS NOT NULL " +
            "ORDER BY t.added DESC, t.id DESC")
    List<Task> findFinishedWithResult(@Param("projectName") String projectName,
                                      @Param("versionName") String versionName,
                                      @Param("taskType") TaskType taskType,
                                      @Param("excluded") Collection<TaskStatus> excluded,
                                      Pageable pageable);

    @Modifying
    @Query("DELETE FROM Task t WHERE t.projectName = :projectName AND t.versionName = :versionName")
    int deleteByRelease(@Param("projectName") String projectName, @Param("versionName") String versionName);
}

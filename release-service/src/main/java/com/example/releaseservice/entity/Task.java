package com.example.releaseservice.entity;

import com.example.releaseservice.support.UtcTimestamps;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * A background job and its execution record.
 *
 * <p>Status changes are made only through conditional updates in
 * {@link com.example.releaseservice.repository.TaskRepository}; the table's
 * check constraint rejects rows whose timestamps and pid disagree with the status.
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_status_added", columnList = "status,added"),
        @Index(name = "idx_tasks_release", columnList = "project_name,version_name,revision_number")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 60)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    /**
     * Job arguments as JSON text.
     */
    @Column(name = "task_args", length = 20000)
    private String taskArgs;

    @Column(name = "added", nullable = false, updatable = false)
    private Instant added;

    /**
     * Earliest time a worker may claim the task; null means immediately.
     */
    @Column(name = "scheduled")
    private Instant scheduled;

    @Column(name = "started")
    private Instant started;

    @Column(name = "pid")
    private Integer pid;

    @Column(name = "completed")
    private Instant completed;

    /**
     * Encoded result payload; decode with the task's type.
     */
    @Column(name = "result", length = 20000)
    private String result;

    @Column(name = "error", length = 4000)
    private String error;

    @Column(name = "asf_uid", length = 100)
    private String asfUid;

    @Column(name = "project_name", length = 100)
    private String projectName;

    @Column(name = "version_name", length = 100)
    private String versionName;

    @Column(name = "revision_number")
    private Integer revisionNumber;

    public OffsetDateTime addedUtc() {
        return UtcTimestamps.denormalize(added);
    }

    public OffsetDateTime startedUtc() {
        return UtcTimestamps.denormalize(started);
    }

    public OffsetDateTime completedUtc() {
        return UtcTimestamps.denormalize(completed);
    }
}

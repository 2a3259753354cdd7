package com.example.releaseservice.metrics;

import com.example.releaseservice.entity.ReleasePhase;
import com.example.releaseservice.entity.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics component for the release store.
 *
 * Exposes:
 * - revisions_created_total: Counter of revisions written
 * - revision_allocation_conflicts_total: Allocations that exhausted their retry
 * - task_transitions_total: Counter of task status changes by target status
 * - release_phase_transitions_total: Counter of release phase changes by target phase
 * - constraint_violation_count: Writes rejected by a database or business constraint
 */
@Component
@Slf4j
public class StoreMetrics {

    private final Counter revisionsCreatedCounter;
    private final Counter allocationConflictCounter;
    private final Counter constraintViolationCounter;
    private final Map<TaskStatus, Counter> taskTransitionCounters = new EnumMap<>(TaskStatus.class);
    private final Map<ReleasePhase, Counter> phaseTransitionCounters = new EnumMap<>(ReleasePhase.class);

    public StoreMetrics(MeterRegistry meterRegistry) {
        this.revisionsCreatedCounter = Counter.builder("revisions_created_total")
                .description("Number of revisions written")
                .register(meterRegistry);

        this.allocationConflictCounter = Counter.builder("revision_allocation_conflicts_total")
                .description("Revision allocations that collided on every attempt")
                .register(meterRegistry);

        this.constraintViolationCounter = Counter.builder("constraint_violation_count")
                .description("Number of writes rejected by a constraint")
                .register(meterRegistry);

        for (TaskStatus status : TaskStatus.values()) {
            taskTransitionCounters.put(status, Counter.builder("task_transitions_total")
                    .description("Task status changes")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry));
        }

        for (ReleasePhase phase : ReleasePhase.values()) {
            phaseTransitionCounters.put(phase, Counter.builder("release_phase_transitions_total")
                    .description("Release phase changes")
                    .tag("phase", phase.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    public void recordRevisionCreated() {
        revisionsCreatedCounter.increment();
    }

    public void recordAllocationConflict() {
        allocationConflictCounter.increment();
        log.warn("Recorded revision allocation conflict");
    }

    /**
     * QUEUED counts enqueued tasks.
     */
    public void recordTaskTransition(TaskStatus target) {
        taskTransitionCounters.get(target).increment();
        log.debug("Recorded task transition: status={}", target);
    }

    /**
     * RELEASE_CANDIDATE_DRAFT counts newly created releases.
     */
    public void recordPhaseTransition(ReleasePhase target) {
        phaseTransitionCounters.get(target).increment();
        log.debug("Recorded phase transition: phase={}", target);
    }

    public void recordConstraintViolation() {
        constraintViolationCounter.increment();
    }
}

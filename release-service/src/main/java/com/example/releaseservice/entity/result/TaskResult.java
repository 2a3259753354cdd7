package com.example.releaseservice.entity.result;

/**
 * Marker for structured task result payloads. The concrete record is chosen
 * by the owning task's {@link com.example.releaseservice.entity.TaskType}.
 */
public interface TaskResult {
}

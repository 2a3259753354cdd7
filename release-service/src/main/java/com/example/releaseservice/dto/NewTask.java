package com.example.releaseservice.dto;

import com.example.releaseservice.entity.TaskType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Request to enqueue a task. {@code scheduled} null means claimable at once.
 */
@Builder
public record NewTask(
        @NotNull(message = "Task type is required")
        TaskType taskType,

        Map<String, Object> taskArgs,

        @Size(max = 100, message = "ASF uid must not exceed 100 characters")
        String asfUid,

        @Size(max = 100, message = "Project name must not exceed 100 characters")
        String projectName,

        @Size(max = 100, message = "Version must not exceed 100 characters")
        String versionName,

        @Positive(message = "Revision number must be positive")
        Integer revisionNumber,

        OffsetDateTime scheduled
) {
}

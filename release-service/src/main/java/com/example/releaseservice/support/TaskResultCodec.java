package com.example.releaseservice.support;

import com.example.releaseservice.entity.TaskType;
import com.example.releaseservice.entity.result.TaskResult;
import com.example.releaseservice.exception.UnknownResultShapeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Encodes task result payloads to JSON text and decodes them back.
 *
 * <p>The JSON carries no type tag: the owning task's {@code task_type} column
 * is the discriminator, and each type maps to exactly one result record.
 */
@Component
@Slf4j
public class TaskResultCodec {

    private final ObjectMapper objectMapper;
    private final Map<TaskType, Class<? extends TaskResult>> shapes;

    public TaskResultCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Map<TaskType, Class<? extends TaskResult>> registered = new EnumMap<>(TaskType.class);
        for (TaskType type : TaskType.values()) {
            if (type.resultType() != null) {
                registered.put(type, type.resultType());
            }
        }
        this.shapes = Collections.unmodifiableMap(registered);
    }

    /**
     * @return JSON text, or null when there is no result
     * @throws UnknownResultShapeException when the result is not the shape registered for the type
     */
    public String encode(TaskType taskType, TaskResult result) {
        if (result == null) {
            return null;
        }
        Class<? extends TaskResult> shape = shapeOf(taskType);
        if (!shape.isInstance(result)) {
            throw new UnknownResultShapeException(String.format(
                "Task type %s produces %s, not %s",
                taskType, shape.getSimpleName(), result.getClass().getSimpleName()));
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new UnknownResultShapeException("Cannot encode result of task type " + taskType, ex);
        }
    }

    /**
     * @return the decoded record, or null when no result was stored
     * @throws UnknownResultShapeException when the type is unregistered or the text is not of its shape
     */
    public TaskResult decode(TaskType taskType, String json) {
        if (json == null) {
            return null;
        }
        Class<? extends TaskResult> shape = shapeOf(taskType);
        try {
            return objectMapper.readerFor(shape)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(json);
        } catch (JsonProcessingException ex) {
            log.warn("Stored result does not match shape taskType={} shape={}", taskType, shape.getSimpleName());
            throw new UnknownResultShapeException(
                String.format("Result of task type %s is not a %s", taskType, shape.getSimpleName()), ex);
        }
    }

    /**
     * Decodes using the raw discriminator text as stored in the task row.
     */
    public TaskResult decode(String taskTypeName, String json) {
        TaskType taskType = TaskType.fromName(taskTypeName)
            .orElseThrow(() -> new UnknownResultShapeException("Unknown task type: " + taskTypeName));
        return decode(taskType, json);
    }

    private Class<? extends TaskResult> shapeOf(TaskType taskType) {
        Class<? extends TaskResult> shape = taskType == null ? null : shapes.get(taskType);
        if (shape == null) {
            throw new UnknownResultShapeException("No result shape registered for task type " + taskType);
        }
        return shape;
    }
}

package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Outcome of one task attempt. Appended to the workflow state and never changed afterwards.
 *
 * @param taskId    the task this result belongs to
 * @param status    success, error or failed_safe
 * @param output    task output on success (nullable)
 * @param error     error message on failure (nullable)
 * @param elapsedMs execution time in milliseconds (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
    String taskId,
    TaskStatus status,
    Object output,
    String error,
    Long elapsedMs
) implements Serializable {

    public static TaskResult success(String taskId, Object output, long elapsedMs) {
        return new TaskResult(taskId, TaskStatus.SUCCESS, output, null, elapsedMs);
    }

    public static TaskResult error(String taskId, String error, long elapsedMs) {
        return new TaskResult(taskId, TaskStatus.ERROR, null, error, elapsedMs);
    }

    public static TaskResult failedSafe(String taskId, String error, long elapsedMs) {
        return new TaskResult(taskId, TaskStatus.FAILED_SAFE, null, error, elapsedMs);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isError() {
        return status == TaskStatus.ERROR;
    }
}

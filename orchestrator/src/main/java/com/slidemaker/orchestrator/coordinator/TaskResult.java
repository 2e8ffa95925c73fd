package com.slidemaker.orchestrator.coordinator;

/**
 * Outcome of one task. Exactly one of {@code value} / {@code error} is set
 * once the status is terminal.
 */
public record TaskResult<R>(String id, TaskStatus status, R value, Throwable error) {

    public static <R> TaskResult<R> pending(String id) {
        return new TaskResult<>(id, TaskStatus.PENDING, null, null);
    }

    public static <R> TaskResult<R> success(String id, R value) {
        return new TaskResult<>(id, TaskStatus.SUCCESS, value, null);
    }

    public static <R> TaskResult<R> failed(String id, Throwable error) {
        return new TaskResult<>(id, TaskStatus.FAILED, null, error);
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }
}

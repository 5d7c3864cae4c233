package com.example.inventorytasks.service.handler;

import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskType;

import java.time.Duration;

/**
 * Executes one {@link TaskType}. Implementations are stateless Spring beans
 * and report failures through {@link TaskExecutionResult} rather than throwing;
 * retries are the executor's business.
 */
public interface TaskHandler {

    TaskType getTaskType();

    TaskExecutionResult execute(OffloadedTask task);

    /**
     * Reject a task that can never succeed before any work is done.
     *
     * @throws IllegalArgumentException if the task is malformed
     */
    default void validate(OffloadedTask task) {
        if (task.getReferenceId() == null || task.getReferenceId().isBlank()) {
            throw new IllegalArgumentException("Task " + task.getId() + " has no reference id");
        }
    }

    /**
     * How long to wait after the {@code failedAttempts}-th failure
     */
    default Duration retryDelay(int failedAttempts, Duration configuredDelay) {
        return configuredDelay;
    }
}

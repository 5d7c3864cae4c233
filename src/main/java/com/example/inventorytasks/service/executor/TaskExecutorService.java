package com.example.inventorytasks.service.executor;

import com.example.inventorytasks.config.InventoryTaskProperties;
import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.entity.TaskExecutionLog;
import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import com.example.inventorytasks.domain.repository.TaskExecutionLogRepository;
import com.example.inventorytasks.service.alert.SlackAlertService;
import com.example.inventorytasks.service.handler.TaskExecutionResult;
import com.example.inventorytasks.service.handler.TaskHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one claimed task and moves it to its next state.
 * <p>
 * A retryable failure goes back to the queue until {@code default-max-retries}
 * attempts have failed; then the task is parked as MAX_RETRIES_EXCEEDED and
 * Slack is alerted. A rejected task is dead-lettered straight away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskExecutorService {

    private final OffloadedTaskRepository taskRepository;
    private final TaskExecutionLogRepository attemptRepository;
    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final InventoryTaskProperties properties;

    private final String workerId = WorkerId.resolve();

    String getWorkerId() {
        return workerId;
    }

    /**
     * Claims up to {@code limit} due tasks for this worker. Rows another worker
     * is reading are skipped; the version check rejects rows changed since the read.
     *
     * @return ids of the tasks this worker now owns, earliest first
     */
    @Transactional
    public List<UUID> claimDueTasks(int limit) {
        var now = Instant.now();
        var claimUntil = now.plus(Duration.ofMinutes(properties.getLockDurationMinutes()));
        var claimed = new ArrayList<UUID>();
        for (var task : taskRepository.findDueTasks(now, limit)) {
            if (taskRepository.claim(task.getId(), task.getVersion(), workerId, claimUntil, now) == 1) {
                claimed.add(task.getId());
            } else {
                log.debug("Task {} was taken by another worker", task.getId());
            }
        }
        return claimed;
    }

    /**
     * @return true if the handler succeeded
     */
    @Transactional
    public boolean executeTask(UUID taskId) {
        var task = taskRepository.findById(taskId).orElse(null);
        if (task == null) {
            log.warn("Task {} disappeared before it could run", taskId);
            return false;
        }
        if (task.getStatus() != TaskStatus.PROCESSING || !workerId.equals(task.getLockedBy())) {
            log.warn("Task {} is {} and not claimed by {}, not running it", taskId, task.getStatus(), workerId);
            return false;
        }

        log.info("Running {} task {} for reference {} (attempt {})", task.getTaskType(), taskId, task.getReferenceId(), task.attemptNumber());

        var sample = metricsConfig.startTimer();
        var attempt = TaskExecutionLog.started(task, workerId, Instant.now());
        var result = run(task);
        var finishedAt = Instant.now();

        if (result.isSuccess()) {
            task.complete(result.getResponseData(), finishedAt);
            attempt.succeeded(result.getResponseData(), finishedAt);
            log.info("Task {} completed in {}ms", taskId, attempt.getDurationMs());
        } else {
            applyFailure(task, result, finishedAt);
            attempt.failed(task.getStatus(), result.getErrorType(), result.getErrorMessage(), result.getStackTrace(), finishedAt);
            metricsConfig.recordTaskFailure(task.getTaskType(), result.getErrorType());
        }

        taskRepository.save(task);
        attemptRepository.save(attempt);
        metricsConfig.recordTaskRun(sample, task.getTaskType(), task.getStatus());

        if (task.getStatus() == TaskStatus.MAX_RETRIES_EXCEEDED) {
            slackAlertService.taskRetriesExhausted(task);
        }
        return result.isSuccess();
    }

    private TaskExecutionResult run(OffloadedTask task) {
        var handler = handlerRegistry.find(task.getTaskType()).orElse(null);
        if (handler == null) {
            return TaskExecutionResult.reject("No handler for task type " + task.getTaskType(), "NO_HANDLER");
        }

        try {
            handler.validate(task);
        } catch (IllegalArgumentException e) {
            log.error("Task {} rejected: {}", task.getId(), e.getMessage());
            return TaskExecutionResult.reject(e.getMessage(), "VALIDATION_ERROR");
        }

        try {
            return handler.execute(task);
        } catch (RuntimeException e) {
            log.error("Handler for task {} threw {}", task.getId(), e.toString(), e);
            return TaskExecutionResult.retry(e);
        }
    }

    private void applyFailure(OffloadedTask task, TaskExecutionResult result, Instant at) {
        var failedAttempt = task.attemptNumber();

        if (!result.isRetryable()) {
            log.error("Task {} dead-lettered: {}", task.getId(), result.getErrorMessage());
            task.deadLetter(result.getErrorMessage(), at);
        } else if (failedAttempt >= properties.getDefaultMaxRetries()) {
            log.error("Task {} failed {} times, giving up: {}", task.getId(), failedAttempt, result.getErrorMessage());
            task.exhaustRetries(result.getErrorMessage(), at);
        } else {
            var configured = Duration.ofMinutes(properties.getDefaultRetryDelayMinutes());
            var delay = handlerRegistry.find(task.getTaskType())
                    .map(handler -> handler.retryDelay(failedAttempt, configured))
                    .orElse(configured);
            task.retryAt(at.plus(delay), result.getErrorMessage());
            log.warn("Task {} failed on attempt {}, next attempt at {}: {}", task.getId(), failedAttempt, task.getScheduledTime(), result.getErrorMessage());
        }
    }
}

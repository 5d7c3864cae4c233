package com.example.inventorytasks.service.executor;

import com.example.inventorytasks.config.InventoryTaskProperties;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds due tasks from the queue to the worker pool, and puts tasks abandoned
 * by a dead worker back in the queue.
 */
@Slf4j
@Service
public class TaskPollingService {

    static final String ABANDONED_REASON = "Worker stopped before finishing the task";

    private final OffloadedTaskRepository taskRepository;
    private final TaskExecutorService taskExecutorService;
    private final InventoryTaskProperties properties;
    private final ExecutorService taskWorkerExecutor;

    private final AtomicBoolean polling = new AtomicBoolean(false);

    public TaskPollingService(OffloadedTaskRepository taskRepository, TaskExecutorService taskExecutorService,
                              InventoryTaskProperties properties,
                              @Qualifier("taskWorkerExecutor") ExecutorService taskWorkerExecutor) {
        this.taskRepository = taskRepository;
        this.taskExecutorService = taskExecutorService;
        this.properties = properties;
        this.taskWorkerExecutor = taskWorkerExecutor;
    }

    /**
     * One batch per cycle; the cycle waits for its batch so batches never overlap.
     */
    @Scheduled(fixedDelayString = "${inventory-tasks.poll-interval-ms:10000}",
            initialDelayString = "${inventory-tasks.poll-initial-delay-ms:10000}")
    @SchedulerLock(name = "offloadedTaskPoller", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void pollAndProcessTasks() {
        if (!polling.compareAndSet(false, true)) {
            log.debug("Previous batch still running");
            return;
        }

        try {
            var claimed = taskExecutorService.claimDueTasks(properties.getBatchSize());
            if (claimed.isEmpty()) {
                return;
            }

            log.info("Dispatching {} claimed task(s)", claimed.size());
            var runs = new ArrayList<CompletableFuture<Boolean>>(claimed.size());
            for (var taskId : claimed) {
                runs.add(CompletableFuture.supplyAsync(() -> run(taskId), taskWorkerExecutor));
            }

            var succeeded = awaitBatch(runs);
            log.info("Batch finished: {} of {} task(s) succeeded", succeeded, claimed.size());
        } catch (DataAccessException e) {
            log.error("Could not read the task queue: {}", e.getMessage(), e);
        } finally {
            polling.set(false);
        }
    }

    private boolean run(UUID taskId) {
        try {
            return taskExecutorService.executeTask(taskId);
        } catch (RuntimeException e) {
            log.error("Task {} could not be run: {}", taskId, e.getMessage(), e);
            return false;
        }
    }

    private long awaitBatch(List<CompletableFuture<Boolean>> runs) {
        try {
            CompletableFuture.allOf(runs.toArray(new CompletableFuture[0]))
                    .get(properties.getLockDurationMinutes(), TimeUnit.MINUTES);
        } catch (TimeoutException | ExecutionException e) {
            log.warn("Not waiting for the rest of the batch: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the batch");
        }

        return runs.stream()
                .filter(run -> run.isDone() && !run.isCompletedExceptionally() && run.join())
                .count();
    }

    /**
     * Requeue tasks whose claim expired more than {@code stale-task-threshold-minutes} ago.
     */
    @Scheduled(fixedDelayString = "${inventory-tasks.stale-task-check-interval-ms:300000}",
            initialDelayString = "${inventory-tasks.stale-task-initial-delay-ms:60000}")
    @SchedulerLock(name = "abandonedTaskRequeue", lockAtLeastFor = "30s", lockAtMostFor = "5m")
    @Transactional
    public void requeueAbandonedTasks() {
        var now = Instant.now();
        var ids = taskRepository.findAbandonedIds(now.minus(Duration.ofMinutes(properties.getStaleTaskThresholdMinutes())));
        if (ids.isEmpty()) {
            return;
        }

        var requeued = taskRepository.requeue(ids, now.plusSeconds(60), ABANDONED_REASON, now);
        log.warn("Requeued {} task(s) abandoned by their worker", requeued);
    }
}

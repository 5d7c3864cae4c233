package com.example.inventorytasks.config;

import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the offloaded task queue, periodic jobs and throttled notifications.
 * Queue gauges are snapshots refreshed from the database on a fixed delay.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final OffloadedTaskRepository taskRepository;

    private final Map<TaskStatus, AtomicLong> tasksByStatus = new EnumMap<>(TaskStatus.class);

    @PostConstruct
    public void registerQueueGauges() {
        for (var status : TaskStatus.values()) {
            var holder = new AtomicLong();
            tasksByStatus.put(status, holder);
            Gauge.builder("inventory_tasks", holder, AtomicLong::get)
                    .tag("status", tag(status))
                    .description("Offloaded tasks by status")
                    .register(meterRegistry);
        }

        Gauge.builder("inventory_tasks_queue_depth", tasksByStatus, MetricsConfig::claimable)
                .description("Offloaded tasks waiting for a worker")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${inventory-tasks.metrics-update-interval-ms:60000}",
            initialDelayString = "${inventory-tasks.metrics-initial-delay-ms:60000}")
    public void refreshQueueGauges() {
        try {
            tasksByStatus.forEach((status, holder) -> holder.set(taskRepository.countByStatus(status)));
        } catch (DataAccessException e) {
            log.warn("Could not refresh task gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTaskOffloaded(TaskType taskType) {
        meterRegistry.counter("inventory_tasks_offloaded", "type", tag(taskType)).increment();
    }

    /** Stops the sample against a timer tagged with the status the task ended the attempt in. */
    public void recordTaskRun(Timer.Sample sample, TaskType taskType, TaskStatus outcome) {
        sample.stop(Timer.builder("inventory_task_run_time")
                .tag("type", tag(taskType))
                .tag("outcome", tag(outcome))
                .description("Duration of one offloaded task attempt")
                .register(meterRegistry));
    }

    public void recordTaskFailure(TaskType taskType, String errorType) {
        meterRegistry.counter("inventory_task_failures",
                "type", tag(taskType),
                "error_type", errorType != null ? errorType : "unknown").increment();
    }

    public void recordJobRun(Timer.Sample sample, String jobName, boolean success) {
        sample.stop(Timer.builder("inventory_job_run_time")
                .tag("job", jobName)
                .tag("success", String.valueOf(success))
                .description("Periodic job run time")
                .register(meterRegistry));
    }

    public void recordNotification(String eventKey, String outcome) {
        meterRegistry.counter("inventory_notifications",
                "event", eventKey,
                "outcome", outcome.toLowerCase(Locale.ROOT)).increment();
    }

    private static double claimable(Map<TaskStatus, AtomicLong> counts) {
        return counts.entrySet().stream()
                .filter(entry -> entry.getKey().isClaimable())
                .mapToLong(entry -> entry.getValue().get())
                .sum();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}

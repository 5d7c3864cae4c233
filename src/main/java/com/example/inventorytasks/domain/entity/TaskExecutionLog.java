package com.example.inventorytasks.domain.entity;

import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.enums.TaskType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt at running an offloaded task. Failed attempts are the service's
 * error log; {@code tasks.delete_old_error_logs} prunes them.
 */
@Entity
@Table(name = "task_execution_logs", indexes = {
        @Index(name = "idx_task_attempt_task", columnList = "task_id"),
        @Index(name = "idx_task_attempt_failed", columnList = "succeeded, started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 50)
    private TaskType taskType;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Column(name = "worker_id", length = 100)
    private String workerId;

    /**
     * Task status once the attempt finished
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 30)
    private TaskStatus outcome;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "succeeded", nullable = false)
    private boolean succeeded;

    @Column(name = "error_type", length = 200)
    private String errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result", columnDefinition = "jsonb")
    private Map<String, Object> result;

    public static TaskExecutionLog started(OffloadedTask task, String workerId, Instant at) {
        return TaskExecutionLog.builder()
                .taskId(task.getId())
                .taskType(task.getTaskType())
                .attempt(task.attemptNumber())
                .workerId(workerId)
                .outcome(TaskStatus.PROCESSING)
                .startedAt(at)
                .build();
    }

    public void succeeded(Map<String, Object> outcomeData, Instant at) {
        end(TaskStatus.COMPLETED, at);
        succeeded = true;
        result = outcomeData;
    }

    public void failed(TaskStatus taskStatus, String type, String message, String detail, Instant at) {
        end(taskStatus, at);
        succeeded = false;
        errorType = type;
        errorMessage = message;
        errorDetail = detail;
    }

    private void end(TaskStatus taskStatus, Instant at) {
        outcome = taskStatus;
        finishedAt = at;
        durationMs = Duration.between(startedAt, at).toMillis();
    }
}

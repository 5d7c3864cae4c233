package com.example.inventorytasks.domain.entity;

import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.enums.TaskType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Work queued for the background workers, e.g. "notify subscribers of part 42".
 * <p>
 * Workers claim a row by setting {@code lockedBy}/{@code lockedUntil} through a
 * version-checked update; the transition methods below release the claim.
 */
@Entity
@Table(name = "offloaded_tasks", indexes = {
        @Index(name = "idx_offloaded_task_due", columnList = "status, scheduled_time"),
        @Index(name = "idx_offloaded_task_reference", columnList = "reference_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OffloadedTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 50)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private TaskStatus status;

    /**
     * Id of the object the task is about; a part id for low stock notifications
     */
    @Column(name = "reference_id", nullable = false, length = 100)
    private String referenceId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    /**
     * Not claimed before this time
     */
    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    /**
     * Failed attempts so far
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result", columnDefinition = "jsonb")
    private Map<String, Object> result;

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static OffloadedTask pending(TaskType taskType, String referenceId, Map<String, Object> payload, Instant now) {
        return OffloadedTask.builder()
                .taskType(taskType)
                .referenceId(referenceId)
                .status(TaskStatus.PENDING)
                .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                .scheduledTime(now)
                .build();
    }

    @PrePersist
    void prePersist() {
        var now = Instant.now();
        createdAt = now;
        updatedAt = now;
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        if (scheduledTime == null) {
            scheduledTime = now;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public int attemptNumber() {
        return retryCount + 1;
    }

    public boolean isClaimedAt(Instant now) {
        return lockedBy != null && lockedUntil != null && lockedUntil.isAfter(now);
    }

    public void complete(Map<String, Object> outcome, Instant at) {
        finish(TaskStatus.COMPLETED, null, at);
        result = outcome;
    }

    /**
     * Retrying cannot help, e.g. the referenced part is gone
     */
    public void deadLetter(String error, Instant at) {
        finish(TaskStatus.DEAD_LETTER, error, at);
    }

    public void exhaustRetries(String error, Instant at) {
        retryCount++;
        finish(TaskStatus.MAX_RETRIES_EXCEEDED, error, at);
    }

    public void retryAt(Instant nextAttempt, String error) {
        retryCount++;
        status = TaskStatus.RETRY_PENDING;
        scheduledTime = nextAttempt;
        lastError = error;
        releaseClaim();
    }

    private void finish(TaskStatus finalStatus, String error, Instant at) {
        status = finalStatus;
        lastError = error;
        completedAt = at;
        releaseClaim();
    }

    private void releaseClaim() {
        lockedBy = null;
        lockedUntil = null;
    }
}

package com.example.inventorytasks.domain.entity;

import com.example.inventorytasks.domain.enums.JobRunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A named periodic job. The name is the stable identity: registration
 * upserts by name, obsolete jobs are deleted by name.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_job_next_run_at", columnList = "next_run_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_scheduled_job_name", columnNames = "name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    /**
     * Identifier resolved through the job handler registry
     */
    @Column(name = "handler", nullable = false, length = 150)
    private String handler;

    @Embedded
    private Cadence cadence;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status", length = 20)
    private JobRunStatus lastStatus;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (nextRunAt == null) {
            nextRunAt = createdAt;
        }
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Record a run that finished at {@code finishedAt} and schedule the next one.
     */
    public void recordRun(Instant finishedAt, JobRunStatus status, String error) {
        this.lastRunAt = finishedAt;
        this.lastStatus = status;
        this.lastError = error;
        this.nextRunAt = cadence.nextRunAfter(finishedAt);
    }
}

package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The offloaded task queue. Several instances poll the same table: due rows are
 * read with {@code FOR UPDATE SKIP LOCKED} and then claimed one by one with a
 * version-checked update.
 */
@Repository
public interface OffloadedTaskRepository extends JpaRepository<OffloadedTask, UUID> {

    /**
     * Due, unclaimed tasks, earliest first. The rows stay locked until the
     * caller's transaction ends, so the claims must be made in that transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = """
            SELECT q.* FROM offloaded_tasks q
            WHERE q.status IN ('PENDING', 'RETRY_PENDING')
              AND q.scheduled_time <= :now
              AND (q.locked_until IS NULL OR q.locked_until < :now)
            ORDER BY q.scheduled_time, q.created_at
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<OffloadedTask> findDueTasks(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * @return 1 if this worker now owns the task, 0 if it changed since it was read
     */
    @Modifying
    @Query("""
            UPDATE OffloadedTask q
            SET q.status = com.example.inventorytasks.domain.enums.TaskStatus.PROCESSING,
                q.lockedBy = :workerId,
                q.lockedUntil = :claimUntil,
                q.startedAt = :now,
                q.updatedAt = :now,
                q.version = q.version + 1
            WHERE q.id = :id
              AND q.version = :version
              AND (q.lockedUntil IS NULL OR q.lockedUntil < :now)
            """)
    int claim(@Param("id") UUID id,
              @Param("version") Long version,
              @Param("workerId") String workerId,
              @Param("claimUntil") Instant claimUntil,
              @Param("now") Instant now);

    /**
     * Running tasks whose claim ran out, most likely because their worker died
     */
    @Query("""
            SELECT q.id FROM OffloadedTask q
            WHERE q.status = com.example.inventorytasks.domain.enums.TaskStatus.PROCESSING
              AND q.lockedUntil < :threshold
            """)
    List<UUID> findAbandonedIds(@Param("threshold") Instant threshold);

    @Modifying
    @Query("""
            UPDATE OffloadedTask q
            SET q.status = com.example.inventorytasks.domain.enums.TaskStatus.RETRY_PENDING,
                q.lockedBy = NULL,
                q.lockedUntil = NULL,
                q.lastError = :reason,
                q.scheduledTime = :retryAt,
                q.updatedAt = :now
            WHERE q.id IN :ids
            """)
    int requeue(@Param("ids") Collection<UUID> ids,
                @Param("retryAt") Instant retryAt,
                @Param("reason") String reason,
                @Param("now") Instant now);

    long countByStatus(TaskStatus status);

    @Modifying
    @Query("""
            DELETE FROM OffloadedTask q
            WHERE q.status = com.example.inventorytasks.domain.enums.TaskStatus.COMPLETED
              AND q.completedAt < :cutoff
            """)
    int deleteCompletedBefore(@Param("cutoff") Instant cutoff);
}

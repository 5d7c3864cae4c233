package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for periodic job registrations.
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

    Optional<ScheduledJob> findByName(String name);

    @Query("SELECT j.name FROM ScheduledJob j ORDER BY j.name")
    List<String> findAllNames();

    /**
     * @return number of registrations removed
     */
    @Modifying
    @Query("DELETE FROM ScheduledJob j WHERE j.name IN :names")
    int deleteByNames(@Param("names") Collection<String> names);

    /**
     * Due jobs, oldest first. SKIP LOCKED keeps two runners from claiming the same row.
     */
    @Query(value = """
            SELECT j.* FROM scheduled_jobs j
            WHERE j.next_run_at <= :now
            ORDER BY j.next_run_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<ScheduledJob> findDueJobs(@Param("now") Instant now, @Param("limit") int limit);
}

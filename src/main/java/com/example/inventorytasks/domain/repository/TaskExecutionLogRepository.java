package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.TaskExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface TaskExecutionLogRepository extends JpaRepository<TaskExecutionLog, UUID> {

    @Modifying
    @Query("DELETE FROM TaskExecutionLog a WHERE a.succeeded = false AND a.startedAt < :cutoff")
    int deleteFailedBefore(@Param("cutoff") Instant cutoff);
}

package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.config.RetentionProperties;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Removes completed offloaded tasks past their retention period.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteSuccessfulTasksJob implements JobHandler {

    private final OffloadedTaskRepository taskRepository;
    private final RetentionProperties retention;

    @Override
    public String getName() {
        return JobNames.DELETE_SUCCESSFUL_TASKS;
    }

    @Override
    @Transactional
    public void run() {
        var cutoff = Instant.now().minus(retention.getSuccessfulTasks());
        var deleted = taskRepository.deleteCompletedBefore(cutoff);
        log.info("Deleted {} completed task(s) older than {}", deleted, cutoff);
    }
}

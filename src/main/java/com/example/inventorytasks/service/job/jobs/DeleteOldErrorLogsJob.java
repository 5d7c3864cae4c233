package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.config.RetentionProperties;
import com.example.inventorytasks.domain.repository.TaskExecutionLogRepository;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Prunes failed execution attempts from the task execution log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteOldErrorLogsJob implements JobHandler {

    private final TaskExecutionLogRepository executionLogRepository;
    private final RetentionProperties retention;

    @Override
    public String getName() {
        return JobNames.DELETE_OLD_ERROR_LOGS;
    }

    @Override
    @Transactional
    public void run() {
        var cutoff = Instant.now().minus(retention.getErrorLogs());
        var deleted = executionLogRepository.deleteFailedBefore(cutoff);
        log.info("Deleted {} error log(s) older than {}", deleted, cutoff);
    }
}

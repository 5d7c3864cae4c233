package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.config.RetentionProperties;
import com.example.inventorytasks.domain.repository.NotificationEntryRepository;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Drops notification throttle records that are far older than any throttle window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteOldNotificationsJob implements JobHandler {

    private final NotificationEntryRepository notificationEntryRepository;
    private final RetentionProperties retention;

    @Override
    public String getName() {
        return JobNames.DELETE_OLD_NOTIFICATIONS;
    }

    @Override
    @Transactional
    public void run() {
        var cutoff = Instant.now().minus(retention.getNotifications());
        var deleted = notificationEntryRepository.deleteSentBefore(cutoff);
        log.info("Deleted {} notification record(s) older than {}", deleted, cutoff);
    }
}

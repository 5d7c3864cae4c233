package com.example.inventorytasks.service.job;

import com.example.inventorytasks.config.InventoryTaskProperties;
import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.domain.entity.ScheduledJob;
import com.example.inventorytasks.domain.enums.JobRunStatus;
import com.example.inventorytasks.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs registered periodic jobs when they fall due.
 * <p>
 * Flow:
 * 1. Poll runs on a fixed delay, ShedLock keeps it to one instance
 * 2. Due jobs are claimed in a short transaction
 * 3. Each job body runs in turn; a failure is recorded and alerted, never rethrown
 * 4. The outcome and the next run time are written back
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRunner {

    private static final int MAX_JOBS_PER_CYCLE = 50;

    private final JobRunTracker runTracker;
    private final JobHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final InventoryTaskProperties properties;

    @Scheduled(fixedDelayString = "${inventory-tasks.job-poll-interval-ms:60000}",
            initialDelayString = "${inventory-tasks.job-initial-delay-ms:30000}")
    @SchedulerLock(name = "periodicJobRunner", lockAtLeastFor = "10s", lockAtMostFor = "30m")
    public void runDueJobs() {
        try {
            var now = Instant.now();
            var lease = Duration.ofMinutes(properties.getLockDurationMinutes());
            var jobs = runTracker.claimDueJobs(now, lease, MAX_JOBS_PER_CYCLE);

            if (jobs.isEmpty()) {
                log.debug("No periodic jobs due");
                return;
            }

            log.info("Running {} due periodic job(s)", jobs.size());
            jobs.forEach(this::runJob);
        } catch (Exception e) {
            log.error("Error in periodic job cycle: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one job and record the outcome.
     *
     * @return true if the job body completed without throwing
     */
    boolean runJob(ScheduledJob job) {
        var sample = metricsConfig.startTimer();
        var startedAt = Instant.now();

        try {
            var handler = handlerRegistry.getHandlerOrThrow(job.getHandler());
            log.info("Running job {}", job.getName());
            handler.run();

            var finishedAt = Instant.now();
            log.info("Job {} finished in {}ms", job.getName(), Duration.between(startedAt, finishedAt).toMillis());
            runTracker.recordRun(job.getId(), finishedAt, JobRunStatus.SUCCESS, null);
            metricsConfig.recordJobRun(sample, job.getName(), true);
            return true;
        } catch (Exception e) {
            log.error("Job {} failed: {}", job.getName(), e.getMessage(), e);
            var error = e.getClass().getSimpleName() + ": " + e.getMessage();
            runTracker.recordRun(job.getId(), Instant.now(), JobRunStatus.FAILED, error);
            metricsConfig.recordJobRun(sample, job.getName(), false);
            slackAlertService.jobFailed(job.getName(), error);
            return false;
        }
    }
}

package com.example.inventorytasks.service.job;

import com.example.inventorytasks.domain.entity.ScheduledJob;
import com.example.inventorytasks.domain.enums.JobRunStatus;
import com.example.inventorytasks.domain.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Short transactions around a job run: claim the due rows before running,
 * record the outcome after. The job body itself runs outside any transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRunTracker {

    private final ScheduledJobRepository jobRepository;

    /**
     * Claim due jobs by pushing {@code nextRunAt} out by {@code lease}, so a
     * crashed runner does not leave a job stuck and a second runner skips it.
     */
    @Transactional
    public List<ScheduledJob> claimDueJobs(Instant now, Duration lease, int limit) {
        var due = jobRepository.findDueJobs(now, limit);
        for (var job : due) {
            job.setNextRunAt(now.plus(lease));
        }
        jobRepository.saveAll(due);
        return due;
    }

    @Transactional
    public void recordRun(UUID jobId, Instant finishedAt, JobRunStatus status, String error) {
        jobRepository.findById(jobId).ifPresentOrElse(job -> {
            job.recordRun(finishedAt, status, error);
            jobRepository.save(job);
            log.debug("Job {} next run at {}", job.getName(), job.getNextRunAt());
        }, () -> log.warn("Job {} was removed while running", jobId));
    }
}

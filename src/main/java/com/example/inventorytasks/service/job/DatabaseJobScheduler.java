package com.example.inventorytasks.service.job;

import com.example.inventorytasks.domain.entity.Cadence;
import com.example.inventorytasks.domain.entity.ScheduledJob;
import com.example.inventorytasks.domain.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * {@link JobScheduler} backed by the {@code scheduled_jobs} table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseJobScheduler implements JobScheduler {

    private final ScheduledJobRepository jobRepository;

    @Override
    @Transactional
    public void schedule(String name, String handler, Cadence cadence) {
        var existing = jobRepository.findByName(name);

        if (existing.isEmpty()) {
            jobRepository.save(ScheduledJob.builder()
                    .name(name)
                    .handler(handler)
                    .cadence(cadence)
                    .nextRunAt(Instant.now())
                    .build());
            log.info("Scheduled new job {} ({})", name, cadence);
            return;
        }

        var job = existing.get();
        if (handler.equals(job.getHandler()) && cadence.equals(job.getCadence())) {
            log.debug("Job {} already scheduled", name);
            return;
        }

        log.info("Updating job {}: handler {} -> {}, cadence {} -> {}",
                name, job.getHandler(), handler, job.getCadence(), cadence);
        var cadenceChanged = !cadence.equals(job.getCadence());
        job.setHandler(handler);
        job.setCadence(cadence);
        if (cadenceChanged && job.getLastRunAt() != null) {
            job.setNextRunAt(cadence.nextRunAfter(job.getLastRunAt()));
        }
        jobRepository.save(job);
    }

    @Override
    @Transactional
    public int deleteByNames(Collection<String> names) {
        if (names.isEmpty()) {
            return 0;
        }
        var removed = jobRepository.deleteByNames(names);
        if (removed > 0) {
            log.info("Removed {} obsolete scheduled job(s)", removed);
        }
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getScheduledNames() {
        return jobRepository.findAllNames();
    }
}

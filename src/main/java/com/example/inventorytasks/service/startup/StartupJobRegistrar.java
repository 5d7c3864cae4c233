package com.example.inventorytasks.service.startup;

import com.example.inventorytasks.exception.DataStoreErrors;
import com.example.inventorytasks.exception.UnknownJobHandlerException;
import com.example.inventorytasks.service.job.JobHandlerRegistry;
import com.example.inventorytasks.service.job.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * Registers the periodic jobs at startup after removing obsolete ones.
 * <p>
 * Registration is an upsert by name, so running it on every boot, or twice in
 * one boot, leaves exactly one row per job.
 */
@Slf4j
@Service
public class StartupJobRegistrar {

    private final JobScheduler jobScheduler;
    private final JobHandlerRegistry handlerRegistry;
    private final List<String> obsoleteJobs;
    private final List<ScheduledJobSpec> startupJobs;

    public StartupJobRegistrar(JobScheduler jobScheduler, JobHandlerRegistry handlerRegistry) {
        this(jobScheduler, handlerRegistry, StartupJobCatalog.OBSOLETE_JOBS, StartupJobCatalog.STARTUP_JOBS);
    }

    StartupJobRegistrar(JobScheduler jobScheduler, JobHandlerRegistry handlerRegistry,
                        List<String> obsoleteJobs, List<ScheduledJobSpec> startupJobs) {
        this.jobScheduler = jobScheduler;
        this.handlerRegistry = handlerRegistry;
        this.obsoleteJobs = obsoleteJobs;
        this.startupJobs = startupJobs;
    }

    /**
     * @return true if the jobs were registered, false if the store was not ready
     * @throws UnknownJobHandlerException if a job names a handler that is not registered,
     *                                    whatever the state of the store
     */
    public boolean registerStartupJobs(InitializationContext context) {
        handlerRegistry.validate(startupJobs.stream().map(ScheduledJobSpec::getHandler).toList());

        if (context.isMigrationMode()) {
            log.info("Schema migration in progress, not registering periodic jobs");
            return false;
        }
        if (!context.getStoreState().isReady()) {
            log.info("Database is {}, not registering periodic jobs", context.getStoreState());
            return false;
        }

        try {
            jobScheduler.deleteByNames(obsoleteJobs);
            for (var startupJob : startupJobs) {
                jobScheduler.schedule(startupJob.getName(), startupJob.getHandler(), startupJob.getCadence());
            }
        } catch (DataAccessException | TransactionException e) {
            if (DataStoreErrors.isNotReady(e)) {
                log.info("Database not ready, periodic jobs not registered: {}", e.getMessage());
            } else {
                log.warn("Could not register periodic jobs, will retry on next startup: {}", e.getMessage());
            }
            return false;
        }

        log.info("Registered {} periodic job(s)", startupJobs.size());
        return true;
    }
}

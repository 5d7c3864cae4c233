package com.example.inventorytasks.service.startup;

import com.example.inventorytasks.domain.entity.Cadence;
import com.example.inventorytasks.service.job.JobNames;

import java.util.List;

/**
 * The fixed set of periodic jobs this service runs, and the names of jobs
 * from earlier versions that must be removed.
 */
public final class StartupJobCatalog {

    public static final List<String> OBSOLETE_JOBS = List.of(
            "tasks.delete_expired_sessions",
            "stock.delete_old_stock_items"
    );

    public static final List<ScheduledJobSpec> STARTUP_JOBS = List.of(
            ScheduledJobSpec.of(JobNames.DELETE_SUCCESSFUL_TASKS, JobNames.DELETE_SUCCESSFUL_TASKS, Cadence.daily()),
            ScheduledJobSpec.of(JobNames.CHECK_FOR_UPDATES, JobNames.CHECK_FOR_UPDATES, Cadence.daily()),
            ScheduledJobSpec.of(JobNames.HEARTBEAT, JobNames.HEARTBEAT, Cadence.everyMinutes(15)),
            ScheduledJobSpec.of(JobNames.UPDATE_EXCHANGE_RATES, JobNames.UPDATE_EXCHANGE_RATES, Cadence.daily()),
            ScheduledJobSpec.of(JobNames.DELETE_OLD_ERROR_LOGS, JobNames.DELETE_OLD_ERROR_LOGS, Cadence.daily()),
            ScheduledJobSpec.of(JobNames.DELETE_OLD_NOTIFICATIONS, JobNames.DELETE_OLD_NOTIFICATIONS, Cadence.daily())
    );

    private StartupJobCatalog() {
    }
}

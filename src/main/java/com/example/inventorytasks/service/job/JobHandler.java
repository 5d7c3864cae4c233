package com.example.inventorytasks.service.job;

/**
 * A periodic job body, registered under a stable name.
 * <p>
 * Implementations are Spring beans; {@link JobHandlerRegistry} collects them
 * and {@link JobRunner} invokes {@link #run()} whenever the job is due.
 * Exceptions thrown from {@code run} are recorded on the job and alerted,
 * the job is rescheduled regardless.
 */
public interface JobHandler {

    /**
     * Identifier stored in {@code scheduled_jobs.handler}
     */
    String getName();

    void run();
}

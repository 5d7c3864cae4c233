package com.example.inventorytasks.service.job;

/**
 * Stable identifiers of the periodic jobs. These strings are persisted in
 * {@code scheduled_jobs}; renaming one requires adding the old name to the
 * obsolete list of the startup registrar.
 */
public final class JobNames {

    public static final String DELETE_SUCCESSFUL_TASKS = "tasks.delete_successful_tasks";
    public static final String CHECK_FOR_UPDATES = "tasks.check_for_updates";
    public static final String HEARTBEAT = "tasks.heartbeat";
    public static final String UPDATE_EXCHANGE_RATES = "tasks.update_exchange_rates";
    public static final String DELETE_OLD_ERROR_LOGS = "tasks.delete_old_error_logs";
    public static final String DELETE_OLD_NOTIFICATIONS = "notifications.delete_old_notifications";

    private JobNames() {
    }
}

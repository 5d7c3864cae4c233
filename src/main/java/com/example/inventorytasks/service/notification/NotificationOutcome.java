package com.example.inventorytasks.service.notification;

/**
 * What {@link ThrottledNotifier#notifyIfDue} did with a notification request.
 */
public enum NotificationOutcome {

    SENT,

    /**
     * Bulk data import in progress
     */
    SKIPPED_IMPORTING,

    /**
     * Already sent for this subject within the throttle window
     */
    SKIPPED_THROTTLED,

    SKIPPED_NO_RECIPIENTS;

    public boolean isSent() {
        return this == SENT;
    }
}

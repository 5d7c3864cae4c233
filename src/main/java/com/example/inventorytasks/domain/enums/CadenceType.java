package com.example.inventorytasks.domain.enums;

/**
 * Recurrence rule kinds for periodic jobs.
 */
public enum CadenceType {

    /**
     * Once every 24 hours
     */
    DAILY,

    /**
     * Every N minutes, N stored alongside the job
     */
    MINUTES
}

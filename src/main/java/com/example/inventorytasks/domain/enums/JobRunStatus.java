package com.example.inventorytasks.domain.enums;

/**
 * Outcome of the last run of a periodic job
 */
public enum JobRunStatus {
    SUCCESS,
    FAILED
}

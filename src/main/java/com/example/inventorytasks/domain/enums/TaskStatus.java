package com.example.inventorytasks.domain.enums;

/**
 * Where an offloaded task is in the queue.
 */
public enum TaskStatus {

    PENDING,

    /**
     * Claimed by a worker
     */
    PROCESSING,

    COMPLETED,

    /**
     * Failed, waiting for its next attempt at {@code scheduled_time}
     */
    RETRY_PENDING,

    /**
     * Every attempt failed; an operator has been alerted
     */
    MAX_RETRIES_EXCEEDED,

    /**
     * Failed in a way another attempt cannot fix (bad reference, unknown part)
     */
    DEAD_LETTER;

    /**
     * Waiting in the queue and may be claimed once due
     */
    public boolean isClaimable() {
        return this == PENDING || this == RETRY_PENDING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == MAX_RETRIES_EXCEEDED || this == DEAD_LETTER;
    }
}

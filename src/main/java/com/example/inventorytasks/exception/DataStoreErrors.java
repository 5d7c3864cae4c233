package com.example.inventorytasks.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies persistence failures seen during startup.
 */
public final class DataStoreErrors {

    private DataStoreErrors() {
    }

    /**
     * True when the failure means the store cannot be used yet: no connection,
     * or a table that has not been created. Such failures are expected on a
     * first boot or during a migration and are not faults.
     */
    public static boolean isNotReady(Throwable e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof InvalidDataAccessResourceUsageException
                || e instanceof CannotCreateTransactionException;
    }
}

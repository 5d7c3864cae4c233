package com.example.inventorytasks.service.startup;

/**
 * Readiness of the persistent store as seen at startup.
 */
public enum StoreState {

    READY,

    /**
     * No connection could be obtained
     */
    UNREACHABLE,

    /**
     * Connected, but the schema has not been created yet (first provisioning pass)
     */
    NOT_PROVISIONED;

    public boolean isReady() {
        return this == READY;
    }
}

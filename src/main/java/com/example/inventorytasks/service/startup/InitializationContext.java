package com.example.inventorytasks.service.startup;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Startup state built once per boot and passed explicitly to each startup step.
 * The only mutable part is the plugin-load guard.
 */
@Getter
@Builder
@ToString
public class InitializationContext {

    private final StoreState storeState;
    private final boolean importingData;
    private final boolean testMode;
    private final boolean migrationMode;
    private final boolean pluginsEnabled;

    private boolean pluginLoadInProgress;

    /**
     * @return false if a plugin load is already running for this context
     */
    public synchronized boolean beginPluginLoad() {
        if (pluginLoadInProgress) {
            return false;
        }
        pluginLoadInProgress = true;
        return true;
    }

    public synchronized void endPluginLoad() {
        pluginLoadInProgress = false;
    }

    public synchronized boolean isPluginLoadInProgress() {
        return pluginLoadInProgress;
    }
}

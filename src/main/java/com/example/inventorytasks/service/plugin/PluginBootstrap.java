package com.example.inventorytasks.service.plugin;

import com.example.inventorytasks.service.startup.InitializationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads plugins once during startup.
 * <p>
 * Whether a load is already running is tracked on the {@link InitializationContext}
 * handed in by the caller, so a nested or repeated call during the same startup
 * is a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PluginBootstrap {

    private final PluginRegistry pluginRegistry;
    private final MaintenanceMode maintenanceMode;

    /**
     * @return true if plugins were collected and loaded
     */
    public boolean loadPlugins(InitializationContext context) {
        if (!context.isPluginsEnabled()) {
            log.debug("Plugins disabled");
            return false;
        }
        if (context.isImportingData()) {
            log.info("Skipping plugin loading for data import");
            return false;
        }
        if (!context.beginPluginLoad()) {
            log.info("Plugin load already in progress, skipping");
            return false;
        }

        maintenanceMode.set(true);
        try {
            log.info("Loading plugins");
            pluginRegistry.collectPlugins();
            pluginRegistry.loadPlugins();
            maintenanceMode.set(false);
            log.info("Plugins loaded: {}", pluginRegistry.getActivePlugins());
            return true;
        } catch (Exception e) {
            log.error("Plugin loading failed, staying in maintenance mode: {}", e.getMessage(), e);
            return false;
        } finally {
            context.endPluginLoad();
        }
    }
}

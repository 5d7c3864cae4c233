package com.example.inventorytasks.service.plugin;

import java.util.List;

/**
 * Discovers and activates plugins. Callers must invoke {@link #collectPlugins()}
 * before {@link #loadPlugins()}.
 */
public interface PluginRegistry {

    void collectPlugins();

    void loadPlugins();

    /**
     * Slugs of plugins activated by the last load
     */
    List<String> getActivePlugins();
}

package com.example.inventorytasks.service.plugin;

/**
 * Extension contributed as a Spring bean and activated once at startup.
 */
public interface InventoryPlugin {

    /**
     * Unique, stable plugin identifier
     */
    String getSlug();

    void activate();
}

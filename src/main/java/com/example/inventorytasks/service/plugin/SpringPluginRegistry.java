package com.example.inventorytasks.service.plugin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plugin registry over the {@link InventoryPlugin} beans in the application context.
 * A plugin whose activation throws is logged and left inactive; the others still load.
 */
@Slf4j
@Component
public class SpringPluginRegistry implements PluginRegistry {

    private final ObjectProvider<InventoryPlugin> pluginProvider;

    private final Map<String, InventoryPlugin> collected = new LinkedHashMap<>();
    private final List<String> active = new ArrayList<>();

    public SpringPluginRegistry(ObjectProvider<InventoryPlugin> pluginProvider) {
        this.pluginProvider = pluginProvider;
    }

    @Override
    public synchronized void collectPlugins() {
        collected.clear();
        pluginProvider.orderedStream().forEach(plugin -> {
            var existing = collected.putIfAbsent(plugin.getSlug(), plugin);
            if (existing != null) {
                log.warn("Duplicate plugin slug '{}': ignoring {}", plugin.getSlug(), plugin.getClass().getSimpleName());
            }
        });
        log.info("Collected {} plugin(s)", collected.size());
    }

    @Override
    public synchronized void loadPlugins() {
        active.clear();
        for (var entry : collected.entrySet()) {
            try {
                entry.getValue().activate();
                active.add(entry.getKey());
                log.info("Activated plugin {}", entry.getKey());
            } catch (Exception e) {
                log.error("Failed to activate plugin {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
    }

    @Override
    public synchronized List<String> getActivePlugins() {
        return Collections.unmodifiableList(new ArrayList<>(active));
    }
}

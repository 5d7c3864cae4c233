package com.example.inventorytasks.service.plugin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide maintenance flag. On while plugins are being loaded, reported by the health endpoint.
 */
@Slf4j
@Component
public class MaintenanceMode {

    private final AtomicBoolean enabled = new AtomicBoolean(false);

    public boolean isEnabled() {
        return enabled.get();
    }

    public void set(boolean value) {
        if (enabled.getAndSet(value) != value) {
            log.info("Maintenance mode {}", value ? "enabled" : "disabled");
        }
    }
}

package com.example.inventorytasks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Flags supplied by the host environment that change what runs at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "inventory.runtime")
public class RuntimeFlagsProperties {

    /**
     * Bulk data import in progress; side-effecting notifications and plugin loading are suppressed
     */
    private boolean importingData = false;

    /**
     * Running under test; the startup exchange-rate refresh is skipped
     */
    private boolean testMode = false;

    /**
     * Process started only to provision or migrate the schema; no jobs are registered
     */
    private boolean migrationMode = false;

    private boolean pluginsEnabled = true;
}

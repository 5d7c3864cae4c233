package com.example.inventorytasks.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the offloaded task queue and the periodic job runner.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "inventory-tasks")
public class InventoryTaskProperties {

    /**
     * Polling interval in milliseconds for checking offloaded tasks
     */
    @Min(1000)
    private long pollIntervalMs = 10000;

    /**
     * Polling interval in milliseconds for checking due periodic jobs
     */
    @Min(1000)
    private long jobPollIntervalMs = 60000;

    /**
     * Maximum number of tasks to fetch per poll cycle
     */
    @Min(1)
    private int batchSize = 50;

    /**
     * Number of worker threads executing offloaded tasks
     */
    @Min(1)
    private int executorPoolSize = 8;

    /**
     * Default maximum attempts for an offloaded task
     */
    @Min(0)
    private int defaultMaxRetries = 5;

    /**
     * Default minutes to wait before retrying a failed task
     */
    @Min(1)
    private int defaultRetryDelayMinutes = 60;

    /**
     * Lock duration in minutes
     */
    @Min(1)
    private int lockDurationMinutes = 30;

    /**
     * Threshold in minutes after which a locked task is considered stale
     */
    @Min(1)
    private int staleTaskThresholdMinutes = 60;
}

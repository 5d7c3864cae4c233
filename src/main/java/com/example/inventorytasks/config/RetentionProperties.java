package com.example.inventorytasks.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * How long housekeeping jobs keep old rows
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "retention")
public class RetentionProperties {

    @NotNull
    private Duration successfulTasks = Duration.ofDays(30);

    @NotNull
    private Duration errorLogs = Duration.ofDays(30);

    @NotNull
    private Duration notifications = Duration.ofDays(90);
}

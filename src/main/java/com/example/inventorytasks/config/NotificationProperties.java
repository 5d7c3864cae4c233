package com.example.inventorytasks.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notifications")
public class NotificationProperties {

    /**
     * Minimum interval between two low-stock e-mails for the same part
     */
    @NotNull
    private Duration lowStockThrottle = Duration.ofDays(1);

    @NotBlank
    private String subjectPrefix = "[Inventory]";

    @NotBlank
    private String fromAddress = "inventory@localhost";

    /**
     * Public base URL used to build absolute links in messages
     */
    @NotBlank
    private String siteUrl = "http://localhost:8080";
}

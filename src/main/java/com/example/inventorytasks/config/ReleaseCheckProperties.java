package com.example.inventorytasks.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Release API used by the update check job
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "release-check")
public class ReleaseCheckProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "https://api.github.com";

    /**
     * Repository in owner/name form
     */
    @NotBlank
    private String repository = "inventree/InvenTree";

    @NotBlank
    private String currentVersion = "0.0.0";

    private int timeoutSeconds = 10;
}

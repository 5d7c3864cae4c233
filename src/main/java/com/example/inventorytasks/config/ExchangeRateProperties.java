package com.example.inventorytasks.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Exchange rate provider configuration
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "exchange-rates")
public class ExchangeRateProperties {

    /**
     * Fallback base currency when the DEFAULT_CURRENCY setting is not stored
     */
    @Pattern(regexp = "[A-Z]{3}")
    private String baseCurrency = "USD";

    /**
     * Currencies to fetch rates for
     */
    @NotEmpty
    private List<String> currencies = new ArrayList<>(List.of("AUD", "CAD", "CNY", "EUR", "GBP", "JPY", "NZD", "USD"));

    @NotBlank
    private String providerBaseUrl = "https://api.frankfurter.app";

    private int timeoutSeconds = 30;
}

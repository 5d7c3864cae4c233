package com.example.inventorytasks.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Exchange Rate Provider ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LatestRatesResponse {
        private BigDecimal amount;
        private String base;
        private String date;
        @Builder.Default
        private Map<String, BigDecimal> rates = new HashMap<>();
    }

    // === Release API ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReleaseResponse {
        @JsonProperty("tag_name")
        private String tagName;
        @JsonProperty("html_url")
        private String htmlUrl;
        @JsonProperty("published_at")
        private String publishedAt;
    }
}

package com.example.inventorytasks.domain.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExchangeBackend Entity Tests")
class ExchangeBackendTest {

    @Test
    @DisplayName("Should update existing rows in place and drop currencies no longer quoted")
    void shouldUpdateRatesInPlace() {
        var backend = ExchangeBackend.builder().name("InventoryExchange").baseCurrency("USD").build();
        backend.updateRates(Map.of("USD", BigDecimal.ONE, "EUR", new BigDecimal("0.9"), "CHF", new BigDecimal("0.88")));
        var eurRow = backend.getRates().stream().filter(rate -> rate.getCurrency().equals("EUR")).findFirst().orElseThrow();

        backend.updateRates(Map.of("USD", BigDecimal.ONE, "EUR", new BigDecimal("0.95")));

        assertThat(backend.getRateMap()).containsOnlyKeys("EUR", "USD").containsEntry("EUR", new BigDecimal("0.95"));
        assertThat(backend.getRates()).contains(eurRow).hasSize(2);
    }
}

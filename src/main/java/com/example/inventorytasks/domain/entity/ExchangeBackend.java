package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State of an exchange rate source: which base currency its rates are quoted
 * against and when they were last refreshed (null if never).
 */
@Entity
@Table(name = "exchange_backends")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExchangeBackend {

    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "base_currency", nullable = false, length = 3)
    private String baseCurrency;

    @Column(name = "last_update")
    private Instant lastUpdate;

    @OneToMany(mappedBy = "backend", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<ExchangeRate> rates = new ArrayList<>();

    /**
     * Make the stored rates equal to {@code newRates}. Existing rows are updated in
     * place, because Hibernate flushes inserts before deletes and a clear-then-add
     * would collide with the (backend, currency) unique key.
     */
    public void updateRates(Map<String, BigDecimal> newRates) {
        rates.removeIf(rate -> !newRates.containsKey(rate.getCurrency()));
        for (var entry : newRates.entrySet()) {
            var existing = rates.stream()
                    .filter(rate -> rate.getCurrency().equals(entry.getKey()))
                    .findFirst();
            if (existing.isPresent()) {
                existing.get().setValue(entry.getValue());
            } else {
                rates.add(ExchangeRate.builder()
                        .backend(this)
                        .currency(entry.getKey())
                        .value(entry.getValue())
                        .build());
            }
        }
    }

    public Map<String, BigDecimal> getRateMap() {
        var map = new TreeMap<String, BigDecimal>();
        rates.forEach(rate -> map.put(rate.getCurrency(), rate.getValue()));
        return map;
    }
}

package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Units of {@code currency} per one unit of the backend's base currency
 */
@Entity
@Table(name = "exchange_rates", uniqueConstraints = {
        @UniqueConstraint(name = "uk_exchange_rate_backend_currency", columnNames = {"backend_name", "currency"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExchangeRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "backend_name", nullable = false)
    private ExchangeBackend backend;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "rate_value", nullable = false, precision = 20, scale = 6)
    private BigDecimal value;
}

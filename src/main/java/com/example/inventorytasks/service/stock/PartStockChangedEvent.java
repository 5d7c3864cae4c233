package com.example.inventorytasks.service.stock;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Published when the stock level of a part changes.
 */
@Getter
@ToString
@AllArgsConstructor
public class PartStockChangedEvent {
    private final Long partId;
    private final BigDecimal previousLevel;
    private final BigDecimal newLevel;
}

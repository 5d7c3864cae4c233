package com.example.inventorytasks.service.startup;

import com.example.inventorytasks.domain.entity.Cadence;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A periodic job to register at startup: stable name, handler identifier and cadence.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class ScheduledJobSpec {
    private final String name;
    private final String handler;
    private final Cadence cadence;
}

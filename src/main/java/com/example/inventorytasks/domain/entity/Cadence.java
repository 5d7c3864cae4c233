package com.example.inventorytasks.domain.entity;

import com.example.inventorytasks.domain.enums.CadenceType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Recurrence rule of a periodic job: daily, or every N minutes.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Cadence {

    @Enumerated(EnumType.STRING)
    @Column(name = "cadence_type", nullable = false, length = 20)
    private CadenceType type;

    /**
     * Interval for MINUTES cadences, null for DAILY
     */
    @Column(name = "interval_minutes")
    private Integer intervalMinutes;

    public static Cadence daily() {
        return new Cadence(CadenceType.DAILY, null);
    }

    public static Cadence everyMinutes(int minutes) {
        if (minutes < 1) {
            throw new IllegalArgumentException("Cadence interval must be at least one minute, got " + minutes);
        }
        return new Cadence(CadenceType.MINUTES, minutes);
    }

    public Duration interval() {
        return type == CadenceType.DAILY ? Duration.ofDays(1) : Duration.ofMinutes(intervalMinutes);
    }

    public Instant nextRunAfter(Instant lastRun) {
        return lastRun.plus(interval());
    }

    @Override
    public String toString() {
        return type == CadenceType.DAILY ? "DAILY" : "EVERY_" + intervalMinutes + "_MINUTES";
    }
}

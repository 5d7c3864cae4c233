package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Global key/value setting shared across service instances.
 */
@Entity
@Table(name = "system_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemSetting {

    public static final String DEFAULT_CURRENCY = "DEFAULT_CURRENCY";
    public static final String LATEST_VERSION = "LATEST_VERSION";
    public static final String WORKER_HEARTBEAT = "WORKER_HEARTBEAT";

    @Id
    @Column(name = "setting_key", nullable = false, length = 100)
    private String key;

    @Column(name = "setting_value", length = 2000)
    private String value;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = Instant.now();
    }
}

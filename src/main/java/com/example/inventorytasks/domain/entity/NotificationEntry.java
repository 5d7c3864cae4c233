package com.example.inventorytasks.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable "last sent" marker for one (event, subject) pair.
 * At most one row exists per pair; later sends move {@code lastSent} forward.
 */
@Entity
@Table(name = "notification_entries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_notification_entry_key_subject", columnNames = {"event_key", "subject_id"})
}, indexes = {
        @Index(name = "idx_notification_entry_updated_at", columnList = "updated_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Event identifier, e.g. part.notify_low_stock
     */
    @Column(name = "event_key", nullable = false, length = 250)
    private String eventKey;

    @Column(name = "subject_id", nullable = false, length = 100)
    private String subjectId;

    @Column(name = "last_sent", nullable = false)
    private Instant lastSent;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean sentWithin(Duration window, Instant now) {
        return lastSent != null && lastSent.plus(window).isAfter(now);
    }
}

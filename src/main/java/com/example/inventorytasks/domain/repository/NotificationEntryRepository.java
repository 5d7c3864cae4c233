package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.NotificationEntry;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Throttle records for outgoing notifications.
 */
@Repository
public interface NotificationEntryRepository extends JpaRepository<NotificationEntry, Long> {

    /**
     * Read the record holding a row lock until the surrounding transaction ends,
     * so concurrent notifiers for the same subject run one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM NotificationEntry n WHERE n.eventKey = :eventKey AND n.subjectId = :subjectId")
    Optional<NotificationEntry> findForUpdate(@Param("eventKey") String eventKey, @Param("subjectId") String subjectId);

    Optional<NotificationEntry> findByEventKeyAndSubjectId(String eventKey, String subjectId);

    /**
     * Create the record or move its timestamp forward. Never produces a second row for the pair.
     */
    @Modifying
    @Query(value = """
            INSERT INTO notification_entries (event_key, subject_id, last_sent, updated_at)
            VALUES (:eventKey, :subjectId, :sentAt, :sentAt)
            ON CONFLICT (event_key, subject_id)
            DO UPDATE SET last_sent = EXCLUDED.last_sent, updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertLastSent(@Param("eventKey") String eventKey, @Param("subjectId") String subjectId, @Param("sentAt") Instant sentAt);

    @Modifying
    @Query("DELETE FROM NotificationEntry n WHERE n.lastSent < :cutoff")
    int deleteSentBefore(@Param("cutoff") Instant cutoff);
}

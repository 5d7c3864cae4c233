package com.example.inventorytasks.service.notification;

import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.config.RuntimeFlagsProperties;
import com.example.inventorytasks.domain.repository.NotificationEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Sends a notification at most once per (event, subject) within a throttle window.
 * <p>
 * The throttle record is read with a row lock and written with an upsert in the
 * same transaction, so concurrent triggers for one subject serialize on its row.
 * Nothing is retried here: a failing sender propagates to the caller and the
 * record is left untouched, so the next attempt is not throttled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThrottledNotifier {

    private final NotificationEntryRepository entryRepository;
    private final RuntimeFlagsProperties runtimeFlags;
    private final MetricsConfig metricsConfig;

    /**
     * @param payloadBuilder    builds the message; only called when a send will happen
     * @param recipientResolver resolves recipients; an empty list skips the send
     */
    @Transactional
    public NotificationOutcome notifyIfDue(String eventKey, String subjectId, Duration throttleWindow,
                                           Supplier<NotificationMessage> payloadBuilder,
                                           Supplier<List<String>> recipientResolver,
                                           NotificationSender sender) {
        var outcome = evaluateAndSend(eventKey, subjectId, throttleWindow, payloadBuilder, recipientResolver, sender);
        metricsConfig.recordNotification(eventKey, outcome.name());
        return outcome;
    }

    private NotificationOutcome evaluateAndSend(String eventKey, String subjectId, Duration throttleWindow,
                                                Supplier<NotificationMessage> payloadBuilder,
                                                Supplier<List<String>> recipientResolver,
                                                NotificationSender sender) {
        if (runtimeFlags.isImportingData()) {
            log.debug("Data import in progress, not sending {} for {}", eventKey, subjectId);
            return NotificationOutcome.SKIPPED_IMPORTING;
        }

        var now = Instant.now();
        var entry = entryRepository.findForUpdate(eventKey, subjectId);
        if (entry.isPresent() && entry.get().sentWithin(throttleWindow, now)) {
            log.info("Notification {} already sent for {} at {}, not sending again", eventKey, subjectId, entry.get().getLastSent());
            return NotificationOutcome.SKIPPED_THROTTLED;
        }

        var recipients = recipientResolver.get();
        if (recipients == null || recipients.isEmpty()) {
            log.info("No recipients for {} on {}", eventKey, subjectId);
            return NotificationOutcome.SKIPPED_NO_RECIPIENTS;
        }

        var message = payloadBuilder.get();
        sender.send(message.getSubject(), recipients, message.getBody());

        entryRepository.upsertLastSent(eventKey, subjectId, now);
        log.info("Notification {} sent for {} to {} recipient(s)", eventKey, subjectId, recipients.size());
        return NotificationOutcome.SENT;
    }
}

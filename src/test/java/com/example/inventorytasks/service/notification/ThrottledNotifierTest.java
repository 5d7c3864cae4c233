package com.example.inventorytasks.service.notification;

import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.config.RuntimeFlagsProperties;
import com.example.inventorytasks.domain.entity.NotificationEntry;
import com.example.inventorytasks.domain.repository.NotificationEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ThrottledNotifier Tests")
class ThrottledNotifierTest {

    private static final String EVENT_KEY = "part.notify_low_stock";
    private static final String SUBJECT_ID = "42";
    private static final Duration WINDOW = Duration.ofHours(24);

    @Mock
    private NotificationEntryRepository entryRepository;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private NotificationSender sender;

    @Captor
    private ArgumentCaptor<Instant> sentAtCaptor;

    private RuntimeFlagsProperties runtimeFlags;
    private ThrottledNotifier notifier;

    private final Supplier<NotificationMessage> payload = () -> NotificationMessage.builder()
            .subject("[Inventory] Low stock notification")
            .body("Stock is low")
            .build();

    private final Supplier<List<String>> recipients = () -> List.of("buyer@example.com", "stores@example.com");

    @BeforeEach
    void setUp() {
        runtimeFlags = new RuntimeFlagsProperties();
        notifier = new ThrottledNotifier(entryRepository, runtimeFlags, metricsConfig);
    }

    private static NotificationEntry entrySentAt(Instant lastSent) {
        return NotificationEntry.builder()
                .id(1L)
                .eventKey(EVENT_KEY)
                .subjectId(SUBJECT_ID)
                .lastSent(lastSent)
                .updatedAt(lastSent)
                .build();
    }

    private NotificationOutcome notifyNow() {
        return notifier.notifyIfDue(EVENT_KEY, SUBJECT_ID, WINDOW, payload, recipients, sender);
    }

    @Nested
    @DisplayName("Throttle Tests")
    class ThrottleTests {

        @Test
        @DisplayName("Should send and record the time when nothing was sent before")
        void shouldSendWhenNoRecord() {
            // Given
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID)).thenReturn(Optional.empty());

            // When
            var outcome = notifyNow();

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SENT);
            verify(sender).send("[Inventory] Low stock notification", List.of("buyer@example.com", "stores@example.com"), "Stock is low");
            verify(entryRepository).upsertLastSent(eq(EVENT_KEY), eq(SUBJECT_ID), sentAtCaptor.capture());
            assertThat(sentAtCaptor.getValue()).isCloseTo(Instant.now(), within(5, ChronoUnit.SECONDS));
            verify(metricsConfig).recordNotification(EVENT_KEY, "SENT");
        }

        @Test
        @DisplayName("Should not send again inside the throttle window")
        void shouldThrottleInsideWindow() {
            // Given
            var entry = entrySentAt(Instant.now().minus(Duration.ofHours(23)));
            var lastSent = entry.getLastSent();
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID)).thenReturn(Optional.of(entry));

            // When
            var outcome = notifyNow();

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SKIPPED_THROTTLED);
            verifyNoInteractions(sender);
            verify(entryRepository, never()).upsertLastSent(any(), any(), any());
            verify(entryRepository, never()).save(any());
            assertThat(entry.getLastSent()).isEqualTo(lastSent);
            verify(metricsConfig).recordNotification(EVENT_KEY, "SKIPPED_THROTTLED");
        }

        @Test
        @DisplayName("Should send again once the window has passed")
        void shouldSendAfterWindow() {
            // Given
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID))
                    .thenReturn(Optional.of(entrySentAt(Instant.now().minus(Duration.ofHours(25)))));

            // When
            var outcome = notifyNow();

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SENT);
            verify(sender).send(anyString(), anyList(), anyString());
            verify(entryRepository).upsertLastSent(eq(EVENT_KEY), eq(SUBJECT_ID), any(Instant.class));
        }

        @Test
        @DisplayName("Should not build the payload when throttled")
        void shouldNotBuildPayloadWhenThrottled() {
            // Given
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID))
                    .thenReturn(Optional.of(entrySentAt(Instant.now().minus(Duration.ofMinutes(5)))));
            Supplier<NotificationMessage> failingPayload = () -> {
                throw new AssertionError("payload must not be built");
            };

            // When
            var outcome = notifier.notifyIfDue(EVENT_KEY, SUBJECT_ID, WINDOW, failingPayload, recipients, sender);

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SKIPPED_THROTTLED);
        }
    }

    @Nested
    @DisplayName("Skip Tests")
    class SkipTests {

        @Test
        @DisplayName("Should skip everything while data is being imported")
        void shouldSkipWhileImporting() {
            // Given
            runtimeFlags.setImportingData(true);

            // When
            var outcome = notifyNow();

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SKIPPED_IMPORTING);
            verifyNoInteractions(entryRepository, sender);
            verify(metricsConfig).recordNotification(EVENT_KEY, "SKIPPED_IMPORTING");
        }

        @Test
        @DisplayName("Should skip and leave the record alone when nobody is subscribed")
        void shouldSkipWithoutRecipients() {
            // Given
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID)).thenReturn(Optional.empty());

            // When
            var outcome = notifier.notifyIfDue(EVENT_KEY, SUBJECT_ID, WINDOW, payload, List::of, sender);

            // Then
            assertThat(outcome).isEqualTo(NotificationOutcome.SKIPPED_NO_RECIPIENTS);
            verifyNoInteractions(sender);
            verify(entryRepository, never()).upsertLastSent(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should propagate a send failure without writing the record")
        void shouldPropagateSendFailure() {
            // Given
            when(entryRepository.findForUpdate(EVENT_KEY, SUBJECT_ID)).thenReturn(Optional.empty());
            doThrow(new MailSendException("SMTP unavailable")).when(sender).send(anyString(), anyList(), anyString());

            // When / Then
            assertThatThrownBy(() -> notifyNow())
                    .isInstanceOf(MailSendException.class)
                    .hasMessageContaining("SMTP unavailable");
            verify(entryRepository, never()).upsertLastSent(any(), any(), any());
            verify(entryRepository, never()).save(any());
            verify(metricsConfig, never()).recordNotification(any(), any());
        }
    }
}

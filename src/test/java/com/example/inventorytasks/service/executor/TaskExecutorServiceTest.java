package com.example.inventorytasks.service.executor;

import com.example.inventorytasks.config.InventoryTaskProperties;
import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.entity.TaskExecutionLog;
import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import com.example.inventorytasks.domain.repository.TaskExecutionLogRepository;
import com.example.inventorytasks.service.alert.SlackAlertService;
import com.example.inventorytasks.service.handler.TaskExecutionResult;
import com.example.inventorytasks.service.handler.TaskHandler;
import com.example.inventorytasks.service.handler.TaskHandlerRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskExecutorService Tests")
class TaskExecutorServiceTest {

    @Mock
    private OffloadedTaskRepository taskRepository;

    @Mock
    private TaskExecutionLogRepository attemptRepository;

    @Mock
    private TaskHandlerRegistry handlerRegistry;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private TaskHandler handler;

    @Mock
    private Timer.Sample sample;

    @Captor
    private ArgumentCaptor<TaskExecutionLog> attemptCaptor;

    private InventoryTaskProperties properties;
    private TaskExecutorService executor;
    private OffloadedTask task;

    @BeforeEach
    void setUp() {
        properties = new InventoryTaskProperties();
        executor = new TaskExecutorService(taskRepository, attemptRepository, handlerRegistry,
                slackAlertService, metricsConfig, properties);

        task = OffloadedTask.builder()
                .id(UUID.randomUUID())
                .taskType(TaskType.NOTIFY_LOW_STOCK)
                .status(TaskStatus.PROCESSING)
                .referenceId("42")
                .scheduledTime(Instant.now().minusSeconds(60))
                .retryCount(0)
                .lockedBy(executor.getWorkerId())
                .lockedUntil(Instant.now().plusSeconds(1800))
                .version(2L)
                .build();
    }

    private void givenClaimedTask() {
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(metricsConfig.startTimer()).thenReturn(sample);
        when(handlerRegistry.find(TaskType.NOTIFY_LOW_STOCK)).thenReturn(Optional.of(handler));
    }

    @Nested
    @DisplayName("executeTask")
    class ExecuteTask {

        @Test
        @DisplayName("Should complete the task and record a successful attempt")
        void shouldCompleteTask() {
            // Given
            givenClaimedTask();
            when(handler.execute(task)).thenReturn(TaskExecutionResult.completed(Map.of("outcome", "SENT")));

            // When
            var succeeded = executor.executeTask(task.getId());

            // Then
            assertThat(succeeded).isTrue();
            assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(task.getCompletedAt()).isNotNull();
            assertThat(task.getLockedBy()).isNull();
            assertThat(task.getResult()).containsEntry("outcome", "SENT");
            verify(taskRepository).save(task);

            verify(attemptRepository).save(attemptCaptor.capture());
            var attempt = attemptCaptor.getValue();
            assertThat(attempt.isSucceeded()).isTrue();
            assertThat(attempt.getAttempt()).isEqualTo(1);
            assertThat(attempt.getWorkerId()).isEqualTo(executor.getWorkerId());
            assertThat(attempt.getOutcome()).isEqualTo(TaskStatus.COMPLETED);

            verify(metricsConfig).recordTaskRun(sample, TaskType.NOTIFY_LOW_STOCK, TaskStatus.COMPLETED);
            verify(metricsConfig, never()).recordTaskFailure(any(), any());
        }

        @Test
        @DisplayName("Should requeue a retryable failure after the handler's delay")
        void shouldScheduleRetry() {
            // Given
            givenClaimedTask();
            when(handler.execute(task)).thenReturn(TaskExecutionResult.retry("Mail server down", "MailSendException"));
            when(handler.retryDelay(1, Duration.ofMinutes(60))).thenReturn(Duration.ofMinutes(60));

            // When
            var succeeded = executor.executeTask(task.getId());

            // Then
            assertThat(succeeded).isFalse();
            assertThat(task.getStatus()).isEqualTo(TaskStatus.RETRY_PENDING);
            assertThat(task.getRetryCount()).isEqualTo(1);
            assertThat(task.getScheduledTime()).isAfter(Instant.now().plusSeconds(3500));
            assertThat(task.getLastError()).isEqualTo("Mail server down");
            assertThat(task.getLockedBy()).isNull();

            verify(attemptRepository).save(attemptCaptor.capture());
            assertThat(attemptCaptor.getValue().isSucceeded()).isFalse();
            assertThat(attemptCaptor.getValue().getErrorType()).isEqualTo("MailSendException");

            verify(metricsConfig).recordTaskFailure(TaskType.NOTIFY_LOW_STOCK, "MailSendException");
            verify(metricsConfig).recordTaskRun(sample, TaskType.NOTIFY_LOW_STOCK, TaskStatus.RETRY_PENDING);
            verify(slackAlertService, never()).taskRetriesExhausted(any());
        }

        @Test
        @DisplayName("Should dead-letter a rejected task without alerting")
        void shouldDeadLetterRejectedTask() {
            // Given
            givenClaimedTask();
            when(handler.execute(task)).thenReturn(TaskExecutionResult.reject("Part not found: 42", "PART_NOT_FOUND"));

            // When
            var succeeded = executor.executeTask(task.getId());

            // Then
            assertThat(succeeded).isFalse();
            assertThat(task.getStatus()).isEqualTo(TaskStatus.DEAD_LETTER);
            assertThat(task.getCompletedAt()).isNotNull();
            assertThat(task.getRetryCount()).isZero();
            verify(metricsConfig).recordTaskFailure(TaskType.NOTIFY_LOW_STOCK, "PART_NOT_FOUND");
            verify(slackAlertService, never()).taskRetriesExhausted(any());
        }

        @Test
        @DisplayName("Should give up and alert when the last allowed attempt fails")
        void shouldExhaustRetries() {
            // Given
            task.setRetryCount(properties.getDefaultMaxRetries() - 1);
            givenClaimedTask();
            when(handler.execute(task)).thenReturn(TaskExecutionResult.retry("Timeout", "TIMEOUT"));

            // When
            executor.executeTask(task.getId());

            // Then
            assertThat(task.getStatus()).isEqualTo(TaskStatus.MAX_RETRIES_EXCEEDED);
            assertThat(task.getRetryCount()).isEqualTo(properties.getDefaultMaxRetries());
            verify(slackAlertService).taskRetriesExhausted(task);
            verify(metricsConfig).recordTaskRun(sample, TaskType.NOTIFY_LOW_STOCK, TaskStatus.MAX_RETRIES_EXCEEDED);
            verify(handler, never()).retryDelay(anyInt(), any());
        }

        @Test
        @DisplayName("Should dead-letter a task that fails validation without executing it")
        void shouldRejectInvalidTask() {
            // Given
            givenClaimedTask();
            doThrow(new IllegalArgumentException("Reference is not a part id: abc")).when(handler).validate(task);

            // When
            var succeeded = executor.executeTask(task.getId());

            // Then
            assertThat(succeeded).isFalse();
            assertThat(task.getStatus()).isEqualTo(TaskStatus.DEAD_LETTER);
            verify(handler, never()).execute(any());
            verify(metricsConfig).recordTaskFailure(TaskType.NOTIFY_LOW_STOCK, "VALIDATION_ERROR");
        }

        @Test
        @DisplayName("Should dead-letter a task whose type has no handler")
        void shouldRejectTaskWithoutHandler() {
            // Given
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
            when(metricsConfig.startTimer()).thenReturn(sample);
            when(handlerRegistry.find(TaskType.NOTIFY_LOW_STOCK)).thenReturn(Optional.empty());

            // When
            executor.executeTask(task.getId());

            // Then
            assertThat(task.getStatus()).isEqualTo(TaskStatus.DEAD_LETTER);
            verify(metricsConfig).recordTaskFailure(TaskType.NOTIFY_LOW_STOCK, "NO_HANDLER");
        }

        @Test
        @DisplayName("Should treat an exception thrown by the handler as retryable")
        void shouldRetryOnHandlerException() {
            // Given
            givenClaimedTask();
            when(handler.execute(task)).thenThrow(new IllegalStateException("Unexpected state"));
            when(handler.retryDelay(anyInt(), any())).thenReturn(Duration.ofMinutes(1));

            // When
            executor.executeTask(task.getId());

            // Then
            assertThat(task.getStatus()).isEqualTo(TaskStatus.RETRY_PENDING);
            verify(metricsConfig).recordTaskFailure(TaskType.NOTIFY_LOW_STOCK, "IllegalStateException");
            verify(attemptRepository).save(attemptCaptor.capture());
            assertThat(attemptCaptor.getValue().getErrorDetail()).contains("IllegalStateException");
        }

        @Test
        @DisplayName("Should not run a task claimed by another worker")
        void shouldSkipForeignClaim() {
            // Given
            task.setLockedBy("other-host:1");
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

            // When
            var succeeded = executor.executeTask(task.getId());

            // Then
            assertThat(succeeded).isFalse();
            verifyNoInteractions(handlerRegistry, attemptRepository);
            verify(taskRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should return false when the task no longer exists")
        void shouldSkipMissingTask() {
            when(taskRepository.findById(task.getId())).thenReturn(Optional.empty());

            assertThat(executor.executeTask(task.getId())).isFalse();
            verifyNoInteractions(handlerRegistry);
        }
    }

    @Nested
    @DisplayName("claimDueTasks")
    class ClaimDueTasks {

        @Test
        @DisplayName("Should claim due tasks against the version that was read")
        void shouldClaimDueTasks() {
            // Given
            when(taskRepository.findDueTasks(any(Instant.class), eq(10))).thenReturn(List.of(task));
            when(taskRepository.claim(eq(task.getId()), eq(2L), eq(executor.getWorkerId()), any(), any())).thenReturn(1);

            // When
            var claimed = executor.claimDueTasks(10);

            // Then
            assertThat(claimed).containsExactly(task.getId());
        }

        @Test
        @DisplayName("Should leave out tasks another worker changed since the read")
        void shouldSkipLostRace() {
            // Given
            var other = OffloadedTask.builder().id(UUID.randomUUID()).taskType(TaskType.NOTIFY_LOW_STOCK)
                    .status(TaskStatus.PENDING).referenceId("43").version(0L).build();
            when(taskRepository.findDueTasks(any(Instant.class), eq(10))).thenReturn(List.of(task, other));
            when(taskRepository.claim(eq(task.getId()), anyLong(), anyString(), any(), any())).thenReturn(0);
            when(taskRepository.claim(eq(other.getId()), anyLong(), anyString(), any(), any())).thenReturn(1);

            // When
            var claimed = executor.claimDueTasks(10);

            // Then
            assertThat(claimed).containsExactly(other.getId());
        }

        @Test
        @DisplayName("Should hold each claim for the configured lock duration")
        void shouldSetClaimExpiry() {
            // Given
            var claimUntil = ArgumentCaptor.forClass(Instant.class);
            when(taskRepository.findDueTasks(any(Instant.class), eq(10))).thenReturn(List.of(task));
            when(taskRepository.claim(any(), anyLong(), anyString(), claimUntil.capture(), any())).thenReturn(1);

            // When
            executor.claimDueTasks(10);

            // Then
            assertThat(claimUntil.getValue())
                    .isAfter(Instant.now().plus(Duration.ofMinutes(properties.getLockDurationMinutes() - 1)));
        }
    }
}

package com.example.inventorytasks.service.executor;

import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskStatus;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskOffloadService Tests")
class TaskOffloadServiceTest {

    @Mock
    private OffloadedTaskRepository taskRepository;

    @Mock
    private MetricsConfig metricsConfig;

    @InjectMocks
    private TaskOffloadService offloadService;

    @Captor
    private ArgumentCaptor<OffloadedTask> taskCaptor;

    @Test
    @DisplayName("Should queue a pending task due now")
    void shouldQueuePendingTask() {
        // Given
        when(taskRepository.save(any(OffloadedTask.class))).thenAnswer(inv -> {
            OffloadedTask task = inv.getArgument(0);
            task.setId(UUID.randomUUID());
            return task;
        });
        var before = Instant.now();

        // When
        var saved = offloadService.offload(TaskType.NOTIFY_LOW_STOCK, "42", Map.of("source", "stock-change"));

        // Then
        verify(taskRepository).save(taskCaptor.capture());
        var task = taskCaptor.getValue();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getTaskType()).isEqualTo(TaskType.NOTIFY_LOW_STOCK);
        assertThat(task.getReferenceId()).isEqualTo("42");
        assertThat(task.getPayload()).containsEntry("source", "stock-change");
        assertThat(task.getScheduledTime()).isAfterOrEqualTo(before);
        assertThat(saved.getId()).isNotNull();
        verify(metricsConfig).recordTaskOffloaded(TaskType.NOTIFY_LOW_STOCK);
    }

    @Test
    @DisplayName("Should default to an empty mutable payload")
    void shouldDefaultToEmptyPayload() {
        // Given
        when(taskRepository.save(any(OffloadedTask.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        var saved = offloadService.offload(TaskType.NOTIFY_LOW_STOCK, "7");

        // Then
        assertThat(saved.getPayload()).isEmpty();
        saved.getPayload().put("k", "v");
        assertThat(saved.getPayload()).containsEntry("k", "v");
    }
}

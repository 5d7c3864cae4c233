package com.example.inventorytasks.service.handler;

import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskHandlerRegistry Tests")
class TaskHandlerRegistryTest {

    private final TaskHandler lowStockHandler = handlerFor(TaskType.NOTIFY_LOW_STOCK);

    private static TaskHandler handlerFor(TaskType type) {
        return new TaskHandler() {
            @Override
            public TaskType getTaskType() {
                return type;
            }

            @Override
            public TaskExecutionResult execute(OffloadedTask task) {
                return TaskExecutionResult.completed();
            }
        };
    }

    @Test
    @DisplayName("Should find the handler registered for a type")
    void shouldFindRegisteredHandler() {
        var registry = new TaskHandlerRegistry(List.of(lowStockHandler));

        assertThat(registry.find(TaskType.NOTIFY_LOW_STOCK)).containsSame(lowStockHandler);
        assertThat(registry.registeredTypes()).containsExactly(TaskType.NOTIFY_LOW_STOCK);
    }

    @Test
    @DisplayName("Should return empty for a type nobody handles")
    void shouldReturnEmptyForUnhandledType() {
        var registry = new TaskHandlerRegistry(List.of());

        assertThat(registry.find(TaskType.NOTIFY_LOW_STOCK)).isEmpty();
        assertThat(registry.registeredTypes()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse two handlers for the same task type at construction")
    void shouldRejectDuplicateHandlers() {
        var duplicate = handlerFor(TaskType.NOTIFY_LOW_STOCK);

        assertThatThrownBy(() -> new TaskHandlerRegistry(List.of(lowStockHandler, duplicate)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Task type NOTIFY_LOW_STOCK is handled by both");
    }

    @Test
    @DisplayName("Should not allow callers to modify the registered types")
    void shouldExposeReadOnlyTypes() {
        var registry = new TaskHandlerRegistry(List.of(lowStockHandler));

        assertThatThrownBy(() -> registry.registeredTypes().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

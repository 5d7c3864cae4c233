package com.example.inventorytasks.service.handler;

import com.example.inventorytasks.domain.enums.TaskType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One {@link TaskHandler} per {@link TaskType}, collected from the context.
 * Two handlers for the same type stop the application from starting.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        for (var handler : handlerBeans) {
            var previous = handlers.putIfAbsent(handler.getTaskType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Task type " + handler.getTaskType() + " is handled by both "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }

        for (var type : TaskType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("Tasks of type {} will be dead-lettered: no handler", type);
            }
        }
        log.info("Task handlers: {}", handlers.keySet());
    }

    public Optional<TaskHandler> find(TaskType taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    public Set<TaskType> registeredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}

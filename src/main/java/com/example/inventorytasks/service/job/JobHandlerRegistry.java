package com.example.inventorytasks.service.job;

import com.example.inventorytasks.exception.UnknownJobHandlerException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Typed registry mapping stable job identifiers to handler beans.
 * <p>
 * Registrations are checked up front: duplicate names fail at startup, and
 * {@link #validate(Collection)} lets callers reject unknown identifiers
 * before anything is scheduled.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers = new TreeMap<>();
    private final List<JobHandler> handlerBeans;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var name = handler.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Job handler " + handler.getClass().getSimpleName() + " has no name");
            }
            var existing = handlers.putIfAbsent(name, handler);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate job handler '%s': %s and %s",
                        name, existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
            log.info("Registered job handler {}: {}", name, handler.getClass().getSimpleName());
        }
    }

    public Optional<JobHandler> getHandler(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    /**
     * @throws UnknownJobHandlerException if nothing is registered under {@code name}
     */
    public JobHandler getHandlerOrThrow(String name) {
        return getHandler(name).orElseThrow(() -> new UnknownJobHandlerException(List.of(name)));
    }

    /**
     * @throws UnknownJobHandlerException naming every identifier that does not resolve
     */
    public void validate(Collection<String> names) {
        var missing = names.stream()
                .filter(name -> !handlers.containsKey(name))
                .distinct()
                .toList();
        if (!missing.isEmpty()) {
            throw new UnknownJobHandlerException(missing);
        }
    }

    public boolean hasHandler(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}

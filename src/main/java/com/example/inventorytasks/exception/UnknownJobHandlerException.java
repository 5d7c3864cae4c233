package com.example.inventorytasks.exception;

import lombok.Getter;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a job refers to a handler identifier that nothing is registered under
 */
@Getter
public class UnknownJobHandlerException extends RuntimeException {

    private final List<String> handlerNames;

    public UnknownJobHandlerException(Collection<String> handlerNames) {
        super("No job handler registered for: " + String.join(", ", handlerNames));
        this.handlerNames = List.copyOf(handlerNames);
    }
}

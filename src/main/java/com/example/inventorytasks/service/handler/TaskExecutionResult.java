package com.example.inventorytasks.service.handler;

import com.example.inventorytasks.exception.StackTraces;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a {@link TaskHandler} reports back to the executor. A failure is either
 * retryable (the queue schedules another attempt) or rejected (dead-lettered).
 */
@Getter
@ToString(exclude = "stackTrace")
public class TaskExecutionResult {

    private final boolean success;
    private final boolean retryable;
    private final String errorMessage;

    /**
     * Short classification used as a metric tag and stored with the attempt
     */
    private final String errorType;

    private final String stackTrace;
    private final Map<String, Object> responseData = new LinkedHashMap<>();

    private TaskExecutionResult(boolean success, boolean retryable, String errorMessage, String errorType, String stackTrace) {
        this.success = success;
        this.retryable = retryable;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.stackTrace = stackTrace;
    }

    public static TaskExecutionResult completed() {
        return new TaskExecutionResult(true, false, null, null, null);
    }

    public static TaskExecutionResult completed(Map<String, Object> responseData) {
        var result = completed();
        if (responseData != null) {
            result.responseData.putAll(responseData);
        }
        return result;
    }

    public static TaskExecutionResult retry(String errorMessage, String errorType) {
        return new TaskExecutionResult(false, true, errorMessage, errorType, null);
    }

    public static TaskExecutionResult retry(Exception error) {
        return new TaskExecutionResult(false, true, error.getMessage(), error.getClass().getSimpleName(), StackTraces.summarize(error));
    }

    /**
     * A failure no later attempt can fix
     */
    public static TaskExecutionResult reject(String errorMessage, String errorType) {
        return new TaskExecutionResult(false, false, errorMessage, errorType, null);
    }

    public TaskExecutionResult with(String key, Object value) {
        responseData.put(key, value);
        return this;
    }
}

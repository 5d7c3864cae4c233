package com.example.inventorytasks.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of work that can be offloaded to the task queue.
 * Each type maps to exactly one handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    /**
     * E-mail subscribers of a part whose stock fell below its minimum
     */
    NOTIFY_LOW_STOCK("part.notify_low_stock", "Low Stock Notification");

    /**
     * Also the throttle event key for notifications sent by this task
     */
    private final String code;

    private final String displayName;
}

package com.example.inventorytasks.service.handler;

import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.exception.PartNotFoundException;
import com.example.inventorytasks.service.notification.LowStockNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.stereotype.Component;

/**
 * Handler for low stock notification tasks.
 * <p>
 * The task reference is the part id. A send failure is retried by the queue;
 * a part that was deleted in the meantime is not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LowStockNotificationHandler implements TaskHandler {

    private final LowStockNotifier lowStockNotifier;

    @Override
    public TaskType getTaskType() {
        return TaskType.NOTIFY_LOW_STOCK;
    }

    @Override
    public void validate(OffloadedTask task) {
        TaskHandler.super.validate(task);
        parsePartId(task);
    }

    @Override
    public TaskExecutionResult execute(OffloadedTask task) {
        var partId = parsePartId(task);
        log.info("Executing low stock notification for part {}", partId);

        try {
            var outcome = lowStockNotifier.notifyLowStock(partId);
            return TaskExecutionResult.completed()
                    .with("partId", partId)
                    .with("outcome", outcome.name());
        } catch (PartNotFoundException e) {
            log.warn("Part {} no longer exists, dropping low stock notification", partId);
            return TaskExecutionResult.reject(e.getMessage(), "PART_NOT_FOUND");
        } catch (MailException e) {
            log.error("Sending low stock notification for part {} failed: {}", partId, e.getMessage());
            return TaskExecutionResult.retry(e);
        }
    }

    private static Long parsePartId(OffloadedTask task) {
        try {
            return Long.valueOf(task.getReferenceId().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Reference ID is not a part id: " + task.getReferenceId(), e);
        }
    }
}

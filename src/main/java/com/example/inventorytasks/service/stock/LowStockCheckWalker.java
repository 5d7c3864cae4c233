package com.example.inventorytasks.service.stock;

import com.example.inventorytasks.domain.entity.Part;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.service.executor.TaskOffloadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Queues a low stock notification for a part and every part above it that is
 * below its minimum stock.
 * <p>
 * Parts are visited child first, up to the root, and offloaded in that order.
 * A failed offload is logged and does not stop the walk.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LowStockCheckWalker {

    private final TaskOffloadService taskOffloadService;

    /**
     * The part's parent chain must be loadable, i.e. call this inside a transaction
     * or with a fully initialized hierarchy.
     *
     * @return number of notifications offloaded
     */
    public int checkAndOffloadLowStockNotifications(Part part) {
        var offloaded = 0;
        for (var node : part.ancestorsIncludingSelf()) {
            if (!node.isLowOnStock()) {
                continue;
            }
            try {
                taskOffloadService.offload(TaskType.NOTIFY_LOW_STOCK, String.valueOf(node.getId()));
                offloaded++;
            } catch (Exception e) {
                log.error("Could not offload low stock notification for part {}: {}", node.getId(), e.getMessage(), e);
            }
        }
        if (offloaded > 0) {
            log.info("Offloaded {} low stock notification(s) starting at part {}", offloaded, part.getId());
        }
        return offloaded;
    }
}

package com.example.inventorytasks.service.stock;

import com.example.inventorytasks.domain.repository.PartRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Checks the part hierarchy for low stock once a stock change has been committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LowStockEventListener {

    private final PartRepository partRepository;
    private final LowStockCheckWalker lowStockCheckWalker;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public void onPartStockChanged(PartStockChangedEvent event) {
        partRepository.findById(event.getPartId()).ifPresentOrElse(
                lowStockCheckWalker::checkAndOffloadLowStockNotifications,
                () -> log.warn("Part {} disappeared before its stock could be checked", event.getPartId()));
    }
}

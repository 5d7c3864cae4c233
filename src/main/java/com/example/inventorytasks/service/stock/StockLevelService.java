package com.example.inventorytasks.service.stock;

import com.example.inventorytasks.domain.entity.Part;
import com.example.inventorytasks.domain.repository.PartRepository;
import com.example.inventorytasks.exception.PartNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Records stock level changes and announces them to interested listeners.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLevelService {

    private final PartRepository partRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @throws PartNotFoundException if the part does not exist
     * @throws IllegalArgumentException if the level is negative
     */
    @Transactional
    public Part updateStockLevel(Long partId, BigDecimal level) {
        if (level == null || level.signum() < 0) {
            throw new IllegalArgumentException("Stock level must be zero or positive, got " + level);
        }

        var part = partRepository.findById(partId).orElseThrow(() -> new PartNotFoundException(partId));
        var previous = part.getInStock();
        if (previous.compareTo(level) == 0) {
            return part;
        }

        part.setInStock(level);
        var saved = partRepository.save(part);
        log.debug("Stock of part {} changed from {} to {}", partId, previous, level);

        eventPublisher.publishEvent(new PartStockChangedEvent(partId, previous, level));
        return saved;
    }
}

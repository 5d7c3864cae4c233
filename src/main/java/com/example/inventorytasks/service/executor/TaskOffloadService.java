package com.example.inventorytasks.service.executor;

import com.example.inventorytasks.config.MetricsConfig;
import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.domain.repository.OffloadedTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;

/**
 * Hands work to the background worker pool. The caller only waits for the
 * queue insert; execution, retries and alerting happen in the executor.
 * <p>
 * Every offload commits on its own, so one failed insert never undoes the
 * others made from the same caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskOffloadService {

    private final OffloadedTaskRepository taskRepository;
    private final MetricsConfig metricsConfig;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OffloadedTask offload(TaskType taskType, String referenceId, Map<String, Object> payload) {
        var task = OffloadedTask.pending(taskType, referenceId, payload, Instant.now());

        var saved = taskRepository.save(task);
        metricsConfig.recordTaskOffloaded(taskType);
        log.info("Offloaded {} task {} for reference {}", taskType, saved.getId(), referenceId);
        return saved;
    }

    /**
     * Needs its own transaction boundary: the call to the three-argument overload
     * does not go through the proxy.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OffloadedTask offload(TaskType taskType, String referenceId) {
        return offload(taskType, referenceId, Map.of());
    }
}

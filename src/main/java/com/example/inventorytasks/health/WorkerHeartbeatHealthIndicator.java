package com.example.inventorytasks.health;

import com.example.inventorytasks.domain.entity.SystemSetting;
import com.example.inventorytasks.service.setting.SystemSettingService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Reports whether the periodic job runner has stamped its heartbeat recently.
 * The heartbeat job runs every 15 minutes; three missed beats mean the runner is down.
 */
@Component("workerHeartbeat")
@RequiredArgsConstructor
public class WorkerHeartbeatHealthIndicator implements HealthIndicator {

    static final Duration MAX_HEARTBEAT_AGE = Duration.ofMinutes(45);

    private final SystemSettingService settingService;

    @Override
    public Health health() {
        try {
            var value = settingService.getValue(SystemSetting.WORKER_HEARTBEAT);
            if (value.isEmpty()) {
                return Health.unknown().withDetail("reason", "No heartbeat recorded yet").build();
            }

            var lastBeat = Instant.parse(value.get());
            var age = Duration.between(lastBeat, Instant.now());
            var builder = age.compareTo(MAX_HEARTBEAT_AGE) <= 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("lastHeartbeat", lastBeat.toString())
                    .withDetail("ageSeconds", age.getSeconds())
                    .build();
        } catch (DataAccessException | DateTimeParseException e) {
            return Health.down(e).build();
        }
    }
}

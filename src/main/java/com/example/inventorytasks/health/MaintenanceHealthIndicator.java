package com.example.inventorytasks.health;

import com.example.inventorytasks.service.plugin.MaintenanceMode;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("maintenance")
@RequiredArgsConstructor
public class MaintenanceHealthIndicator implements HealthIndicator {

    private final MaintenanceMode maintenanceMode;

    @Override
    public Health health() {
        if (maintenanceMode.isEnabled()) {
            return Health.outOfService().withDetail("maintenance", true).build();
        }
        return Health.up().withDetail("maintenance", false).build();
    }
}

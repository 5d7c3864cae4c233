package com.example.inventorytasks.health;

import com.example.inventorytasks.service.plugin.MaintenanceMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MaintenanceHealthIndicator Tests")
class MaintenanceHealthIndicatorTest {

    @Test
    @DisplayName("Should report out of service during maintenance")
    void shouldFollowMaintenanceMode() {
        var maintenanceMode = new MaintenanceMode();
        var indicator = new MaintenanceHealthIndicator(maintenanceMode);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

        maintenanceMode.set(true);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);

        maintenanceMode.set(false);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}

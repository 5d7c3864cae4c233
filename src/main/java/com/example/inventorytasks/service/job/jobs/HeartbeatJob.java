package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.domain.entity.SystemSetting;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import com.example.inventorytasks.service.setting.SystemSettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Stamps the worker heartbeat so health checks can tell the job runner is alive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatJob implements JobHandler {

    private final SystemSettingService settingService;

    @Override
    public String getName() {
        return JobNames.HEARTBEAT;
    }

    @Override
    public void run() {
        var now = Instant.now();
        settingService.setValue(SystemSetting.WORKER_HEARTBEAT, now.toString());
        log.debug("Worker heartbeat at {}", now);
    }
}

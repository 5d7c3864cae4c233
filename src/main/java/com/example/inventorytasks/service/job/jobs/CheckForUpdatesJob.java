package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.client.ReleaseClient;
import com.example.inventorytasks.config.ReleaseCheckProperties;
import com.example.inventorytasks.domain.entity.SystemSetting;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import com.example.inventorytasks.service.setting.SystemSettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks up the latest published release and stores it in the LATEST_VERSION setting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckForUpdatesJob implements JobHandler {

    private final ReleaseClient releaseClient;
    private final SystemSettingService settingService;
    private final ReleaseCheckProperties properties;

    @Override
    public String getName() {
        return JobNames.CHECK_FOR_UPDATES;
    }

    @Override
    public void run() {
        if (!properties.isEnabled()) {
            log.debug("Release check disabled");
            return;
        }

        var release = releaseClient.fetchLatestRelease(properties.getRepository());
        var latest = ReleaseVersion.parse(release.getTagName());
        var current = ReleaseVersion.parse(properties.getCurrentVersion());

        settingService.setValue(SystemSetting.LATEST_VERSION, latest.toString());

        if (latest.isNewerThan(current)) {
            log.warn("A newer release is available: {} (running {})", latest, current);
        } else {
            log.info("Running the latest release ({})", current);
        }
    }
}

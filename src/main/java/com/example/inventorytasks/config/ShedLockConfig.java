package com.example.inventorytasks.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Cluster-wide locks for the scheduled loops: the task poller, the periodic
 * job runner and the abandoned task requeue run on one instance at a time.
 * Individual tasks and jobs are claimed row by row in their repositories.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "15m")
public class ShedLockConfig {

    static final String LOCK_TABLE = "shedlock";

    @Bean
    public LockProvider schedulerLockProvider(JdbcTemplate jdbcTemplate) {
        var configuration = JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(jdbcTemplate)
                .withTableName(LOCK_TABLE)
                // lock expiry compares against the database clock, not each instance's
                .usingDbTime()
                .build();
        return new JdbcTemplateLockProvider(configuration);
    }
}

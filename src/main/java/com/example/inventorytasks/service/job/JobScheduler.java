package com.example.inventorytasks.service.job;

import com.example.inventorytasks.domain.entity.Cadence;

import java.util.Collection;
import java.util.List;

/**
 * Registration side of the periodic job scheduler.
 */
public interface JobScheduler {

    /**
     * Register a job, or update the existing registration with the same name.
     * Never creates a second job with the same name.
     */
    void schedule(String name, String handler, Cadence cadence);

    /**
     * @return number of registrations removed
     */
    int deleteByNames(Collection<String> names);

    List<String> getScheduledNames();
}

package com.csg.finops.budgetcap.application.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Clock used to stamp notification records. Local time, matching the addedAt format of existing records.
 */
@ApplicationScoped
public class ClockConfig {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

package com.homelab.ops.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Clock used for query windows, replaceable in tests.
 */
@ApplicationScoped
public class ClockConfig {

    @Produces
    @Singleton
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}

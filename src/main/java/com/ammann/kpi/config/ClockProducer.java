/* (C)2026 */
package com.ammann.kpi.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the {@link Clock} that decides "today" for report windows.
 *
 * <p>Reports bucket by calendar month without time zones, so the system UTC clock is used.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}

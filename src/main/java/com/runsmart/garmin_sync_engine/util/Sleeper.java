package com.runsmart.garmin_sync_engine.util;

import java.time.Duration;

/**
 * Pauses the current thread between retry attempts. Tests pass a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

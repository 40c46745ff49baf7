package com.runsmart.garmin_sync_engine.metrics;

import java.util.Locale;

public enum ReadinessConfidence {
    HIGH, MEDIUM, LOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

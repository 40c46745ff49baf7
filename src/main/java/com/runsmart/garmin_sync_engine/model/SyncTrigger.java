package com.runsmart.garmin_sync_engine.model;

import java.util.Locale;

public enum SyncTrigger {
    MANUAL, INCREMENTAL, NIGHTLY, BACKFILL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or blank values fall back to {@link #MANUAL}. */
    public static SyncTrigger fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        for (SyncTrigger trigger : values()) {
            if (trigger.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return trigger;
            }
        }
        return MANUAL;
    }
}

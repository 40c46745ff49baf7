package com.runsmart.garmin_sync_engine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Summary types Garmin delivers by webhook, keyed by the JSON field name they arrive under.
 */
public enum GarminDataset {
    ACTIVITIES("activities"),
    MANUALLY_UPDATED_ACTIVITIES("manuallyUpdatedActivities"),
    ACTIVITY_DETAILS("activityDetails"),
    DAILIES("dailies"),
    EPOCHS("epochs"),
    SLEEPS("sleeps"),
    BODY_COMPS("bodyComps"),
    STRESS_DETAILS("stressDetails"),
    USER_METRICS("userMetrics"),
    PULSE_OX("pulseox"),
    ALL_DAY_RESPIRATION("allDayRespiration"),
    HEALTH_SNAPSHOT("healthSnapshot"),
    HRV("hrv"),
    BLOOD_PRESSURES("bloodPressures"),
    SKIN_TEMP("skinTemp");

    private final String key;

    GarminDataset(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isActivity() {
        return this == ACTIVITIES || this == MANUALLY_UPDATED_ACTIVITIES || this == ACTIVITY_DETAILS;
    }

    /** Datasets that feed {@code garmin_daily_metrics}. */
    public boolean isDailyMetricSource() {
        return switch (this) {
            case DAILIES, SLEEPS, USER_METRICS, BODY_COMPS, HRV, STRESS_DETAILS -> true;
            default -> false;
        };
    }

    public static Optional<GarminDataset> fromKey(String key) {
        return Arrays.stream(values()).filter(d -> d.key.equals(key)).findFirst();
    }
}

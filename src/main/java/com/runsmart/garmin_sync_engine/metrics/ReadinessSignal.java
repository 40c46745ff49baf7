package com.runsmart.garmin_sync_engine.metrics;

/**
 * Signals that feed the readiness score, in scoring order, with their weights.
 */
public enum ReadinessSignal {
    HRV("hrv", 0.28),
    SLEEP_SCORE("sleep_score", 0.28),
    RESTING_HR("resting_hr", 0.20),
    STRESS("stress", 0.14),
    BODY_BATTERY("body_battery", 0.10);

    private final String key;
    private final double weight;

    ReadinessSignal(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }

    /** Human label, e.g. {@code sleep score}. */
    public String label() {
        return key.replace('_', ' ');
    }
}

package com.runsmart.garmin_sync_engine.metrics;

/**
 * Per-signal trailing averages. A signal with no samples has a null baseline.
 *
 * @param sampleCount days in the window that carried at least one signal
 */
public record ReadinessBaseline(
        Double hrv,
        Double restingHr,
        Double sleepScore,
        Double stress,
        Double bodyBattery,
        int sampleCount) {

    public static ReadinessBaseline empty() {
        return new ReadinessBaseline(null, null, null, null, null, 0);
    }

    public Double value(ReadinessSignal signal) {
        return switch (signal) {
            case HRV -> hrv;
            case RESTING_HR -> restingHr;
            case SLEEP_SCORE -> sleepScore;
            case STRESS -> stress;
            case BODY_BATTERY -> bodyBattery;
        };
    }
}

package com.runsmart.garmin_sync_engine.metrics;

import java.time.LocalDate;

public record DailySignalSample(
        LocalDate date,
        Double hrv,
        Double restingHr,
        Double sleepScore,
        Double stress,
        Double bodyBattery) {

    public Double value(ReadinessSignal signal) {
        return switch (signal) {
            case HRV -> hrv;
            case RESTING_HR -> restingHr;
            case SLEEP_SCORE -> sleepScore;
            case STRESS -> stress;
            case BODY_BATTERY -> bodyBattery;
        };
    }

    public int availableSignals() {
        int count = 0;
        for (ReadinessSignal signal : ReadinessSignal.values()) {
            if (value(signal) != null) {
                count++;
            }
        }
        return count;
    }
}

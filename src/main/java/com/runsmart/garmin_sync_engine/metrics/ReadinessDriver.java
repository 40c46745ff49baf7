package com.runsmart.garmin_sync_engine.metrics;

/**
 * @param impact one of {@code positive}, {@code negative}, {@code neutral}, {@code missing}
 * @param contribution weighted score, 0 when the signal is missing
 */
public record ReadinessDriver(
        String signal,
        String impact,
        Double value,
        Double baseline,
        double contribution,
        String explanation) {
}

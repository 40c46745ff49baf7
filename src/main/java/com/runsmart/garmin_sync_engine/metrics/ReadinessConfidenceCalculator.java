package com.runsmart.garmin_sync_engine.metrics;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Grades how much a readiness score can be trusted from signal coverage, baseline depth and
 * sync freshness.
 */
@Component
public class ReadinessConfidenceCalculator {

    public static final String NO_SIGNALS_REASON = "No readiness signals were available today.";

    static final int HIGH_MIN_SIGNALS = 4;
    static final int HIGH_MIN_BASELINE = 21;
    static final Duration HIGH_MAX_SYNC_AGE = Duration.ofHours(24);
    static final int MEDIUM_MIN_SIGNALS = 2;
    static final int MEDIUM_MIN_BASELINE = 10;
    static final Duration MEDIUM_MAX_SYNC_AGE = Duration.ofHours(72);

    public record Assessment(ReadinessConfidence confidence, String reason) {
    }

    /**
     * @param evaluatedAt reference time for sync freshness; supplied by the caller
     */
    public Assessment assess(int baselineSampleCount, int availableSignalsToday, Instant lastSyncAt, Instant evaluatedAt) {
        if (availableSignalsToday <= 0) {
            return new Assessment(ReadinessConfidence.LOW, NO_SIGNALS_REASON);
        }
        Duration syncAge = lastSyncAt == null || evaluatedAt == null ? null : Duration.between(lastSyncAt, evaluatedAt);

        if (availableSignalsToday >= HIGH_MIN_SIGNALS
                && baselineSampleCount >= HIGH_MIN_BASELINE
                && withinAge(syncAge, HIGH_MAX_SYNC_AGE)) {
            return new Assessment(ReadinessConfidence.HIGH,
                    availableSignalsToday + " of 5 signals today with a " + baselineSampleCount
                            + "-day baseline and a sync in the last 24 hours.");
        }
        if (availableSignalsToday >= MEDIUM_MIN_SIGNALS
                && baselineSampleCount >= MEDIUM_MIN_BASELINE
                && withinAge(syncAge, MEDIUM_MAX_SYNC_AGE)) {
            return new Assessment(ReadinessConfidence.MEDIUM,
                    availableSignalsToday + " of 5 signals today with a " + baselineSampleCount
                            + "-day baseline; more coverage would raise confidence.");
        }

        String reason;
        if (availableSignalsToday < MEDIUM_MIN_SIGNALS) {
            reason = "Only " + availableSignalsToday + " readiness signal was available today.";
        } else if (baselineSampleCount < MEDIUM_MIN_BASELINE) {
            reason = "Baseline has only " + baselineSampleCount + " days of data so far.";
        } else if (syncAge == null) {
            reason = "Garmin data has not synced yet.";
        } else {
            reason = "Garmin data last synced " + syncAge.toHours() + " hours ago.";
        }
        return new Assessment(ReadinessConfidence.LOW, reason);
    }

    private static boolean withinAge(Duration syncAge, Duration limit) {
        return syncAge != null && !syncAge.isNegative() && syncAge.compareTo(limit) <= 0;
    }
}

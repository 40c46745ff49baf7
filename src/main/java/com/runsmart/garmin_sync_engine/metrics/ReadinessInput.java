package com.runsmart.garmin_sync_engine.metrics;

import java.time.Instant;
import java.util.List;

/**
 * @param evaluatedAt the moment the score is for; sync freshness is measured against it
 */
public record ReadinessInput(
        List<DailySignalSample> samples,
        Instant lastSyncAt,
        TrainingLoad load,
        Instant evaluatedAt) {
}

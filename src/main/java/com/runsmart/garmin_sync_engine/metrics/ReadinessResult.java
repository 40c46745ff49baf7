package com.runsmart.garmin_sync_engine.metrics;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record ReadinessResult(
        LocalDate date,
        int score,
        String state,
        List<ReadinessDriver> drivers,
        String confidence,
        String confidenceReason,
        Instant lastSyncAt,
        List<String> missingSignals,
        UnderRecoverySignature underRecovery,
        TrainingLoad load,
        ReadinessBaseline baseline) {
}

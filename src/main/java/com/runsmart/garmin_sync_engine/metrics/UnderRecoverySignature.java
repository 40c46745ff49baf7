package com.runsmart.garmin_sync_engine.metrics;

import java.util.List;

public record UnderRecoverySignature(
        boolean flagged,
        int triggerCount,
        List<String> triggers,
        String confidence,
        String recommendation) {
}

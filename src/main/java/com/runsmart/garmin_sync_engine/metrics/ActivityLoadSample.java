package com.runsmart.garmin_sync_engine.metrics;

import java.time.Instant;

public record ActivityLoadSample(Instant startTime, Integer durationSeconds, Integer averageHeartRate, Double distanceMeters) {
}

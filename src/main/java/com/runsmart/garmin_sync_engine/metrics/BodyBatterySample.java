package com.runsmart.garmin_sync_engine.metrics;

import java.time.Instant;

public record BodyBatterySample(Instant at, int value) {
}

package com.runsmart.garmin_sync_engine.model;

public record QueueResult(boolean queued, String jobId, String error) {
}

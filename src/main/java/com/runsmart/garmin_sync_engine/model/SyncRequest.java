package com.runsmart.garmin_sync_engine.model;

/**
 * @param sinceIso optional ISO-8601 lower bound overriding the computed lookback
 */
public record SyncRequest(Long userId, SyncTrigger trigger, String sinceIso) {
}

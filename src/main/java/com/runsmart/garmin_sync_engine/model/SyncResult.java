package com.runsmart.garmin_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * What a sync call reports back. {@code noOp} separates "succeeded with nothing new" from a
 * silent failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult(
        int status,
        boolean connected,
        boolean needsReauth,
        Instant lastSyncAt,
        int activitiesUpserted,
        int dailyMetricsUpserted,
        boolean noOp,
        Long retryAfterSeconds,
        String reason,
        String error,
        int attempts,
        boolean deriveQueued,
        List<String> notices) {

    public static final String REASON_NOT_CONNECTED = "not_connected";

    public static SyncResult notConnected() {
        return new SyncResult(401, false, true, null, 0, 0, false, null, REASON_NOT_CONNECTED,
                "Garmin is not connected", 0, false, List.of());
    }

    public static SyncResult rateLimited(Instant lastSyncAt, String reason, Long retryAfterSeconds) {
        return new SyncResult(429, true, false, lastSyncAt, 0, 0, false, retryAfterSeconds, reason,
                "Garmin sync is cooling down", 0, false, List.of());
    }
}

package com.runsmart.garmin_sync_engine.model;

import java.util.List;

/**
 * Outcome of one execution attempt. {@code status} follows HTTP semantics: 2xx success,
 * 401 re-auth needed, 5xx transient.
 */
public record SyncExecution(
        int status,
        int activitiesUpserted,
        int dailyMetricsUpserted,
        String reason,
        String error,
        boolean needsReauth,
        boolean deriveQueued,
        List<String> notices) {

    public static final String REASON_AUTH = "auth_error";
    public static final String REASON_UPSTREAM_UNAVAILABLE = "upstream_unavailable";
    public static final String REASON_UPSTREAM_ERROR = "upstream_error";
    public static final String REASON_STORAGE = "storage_error";

    public static SyncExecution success(int activities, int dailyMetrics, boolean deriveQueued, List<String> notices) {
        return new SyncExecution(200, activities, dailyMetrics, null, null, false, deriveQueued, List.copyOf(notices));
    }

    public static SyncExecution authFailure(String error) {
        return new SyncExecution(401, 0, 0, REASON_AUTH, error, true, false, List.of());
    }

    public static SyncExecution failure(int status, String reason, String error, List<String> notices) {
        return new SyncExecution(status, 0, 0, reason, error, false, false, List.copyOf(notices));
    }

    public boolean isServerError() {
        return status >= 500;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}

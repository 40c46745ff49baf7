package com.runsmart.garmin_sync_engine.model;

import java.util.Map;

/**
 * Downstream request for the daily coaching insight, built from a fresh derived row.
 */
public record InsightsJobPayload(Long userId, String insightType, String date, String requestedAt,
                                 Map<String, Object> derivedSummary) {

    public static final String DAILY = "daily";

    public String jobId() {
        return "ai-insights:user:" + userId + ":" + insightType + ":" + date;
    }
}

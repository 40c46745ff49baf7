package com.runsmart.garmin_sync_engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Activity row ready to upsert on {@code (userId, activityId)}.
 *
 * @param avgPace seconds per kilometre
 */
public record NormalizedActivity(
        Long userId,
        String activityId,
        Instant startTime,
        String sport,
        Integer durationS,
        Double distanceM,
        Integer avgHr,
        Integer maxHr,
        Integer avgPace,
        Double elevationGainM,
        Double calories,
        String source,
        JsonNode raw) {

    public String naturalKey() {
        return userId + ":" + activityId;
    }
}

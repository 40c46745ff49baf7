package com.runsmart.garmin_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.runsmart.garmin_sync_engine.exception.GarminValidationException;

import java.time.Instant;

/**
 * Derive job message. Exactly one of {@code userId} and {@code garminUserId} is set.
 *
 * @param backfillDays number of days ending today to recompute; absent means today only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeriveJobPayload(
        Long userId,
        String garminUserId,
        String datasetKey,
        String source,
        String requestedAt,
        Integer backfillDays) {

    public static DeriveJobPayload forUser(Long userId, String datasetKey, String source, Instant requestedAt, Integer backfillDays) {
        return new DeriveJobPayload(userId, null, datasetKey, source, requestedAt.toString(), backfillDays);
    }

    public static DeriveJobPayload forGarminUser(String garminUserId, String datasetKey, String source, Instant requestedAt) {
        return new DeriveJobPayload(null, garminUserId, datasetKey, source, requestedAt.toString(), null);
    }

    /**
     * @throws GarminValidationException unless exactly one identifier is present
     */
    public DeriveTarget target() {
        boolean hasUser = userId != null;
        boolean hasGarminUser = garminUserId != null && !garminUserId.isBlank();
        if (hasUser == hasGarminUser) {
            throw new GarminValidationException("Derive job needs exactly one of userId or garminUserId");
        }
        return hasUser ? new DeriveTarget.ByUserId(userId) : new DeriveTarget.ByGarminUserId(garminUserId.trim());
    }

    /** Dedupe key: one job per target, dataset and minute. */
    @JsonIgnore
    public String jobId() {
        String who = userId != null ? "user:" + userId : "garmin:" + garminUserId;
        // ISO-8601 up to the minute: 2026-10-18T10:15
        String minute = requestedAt != null && requestedAt.length() > 16 ? requestedAt.substring(0, 16) : requestedAt;
        return "garmin-derive:" + who + ":" + (datasetKey == null ? "all" : datasetKey) + ":" + minute;
    }
}

package com.runsmart.garmin_sync_engine.model;

import java.time.Instant;

/**
 * Resolved time bounds for one sync execution.
 *
 * @param deriveDays days the follow-up derive job recomputes, null for today only
 */
public record SyncPlan(
        Long userId,
        SyncTrigger trigger,
        Instant dailySince,
        Instant activitySince,
        Instant until,
        Integer deriveDays) {
}

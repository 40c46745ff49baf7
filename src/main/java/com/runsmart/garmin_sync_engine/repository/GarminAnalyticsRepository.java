package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.DerivedMetric;
import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;

import java.util.List;

/**
 * Conflict-targeted writes for the analytics tables. Every method is an upsert on the table's
 * natural key, so repeating a call leaves storage unchanged.
 */
public interface GarminAnalyticsRepository {

    /** Upserts on {@code (user_id, activity_id)}; the stored row is replaced. */
    void upsertActivities(List<NormalizedActivity> batch);

    /** Upserts on {@code (user_id, date)}; null columns never overwrite stored values. */
    void upsertDailyMetrics(List<NormalizedDailyMetric> batch);

    /** Upserts on {@code (user_id, date)}; the stored row is replaced. */
    void upsertDerivedMetric(DerivedMetric metric);
}

package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.DerivedMetric;
import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double with the same conflict semantics as the JDBC repository.
 */
public class InMemoryGarminAnalyticsRepository implements GarminAnalyticsRepository {

    public final Map<String, NormalizedActivity> activities = new LinkedHashMap<>();
    public final Map<String, NormalizedDailyMetric> dailyMetrics = new LinkedHashMap<>();
    public final Map<String, DerivedMetric> derivedMetrics = new LinkedHashMap<>();
    public final List<Integer> batchSizes = new ArrayList<>();

    @Override
    public void upsertActivities(List<NormalizedActivity> batch) {
        batchSizes.add(batch.size());
        batch.forEach(row -> activities.put(row.naturalKey(), row));
    }

    @Override
    public void upsertDailyMetrics(List<NormalizedDailyMetric> batch) {
        batchSizes.add(batch.size());
        batch.forEach(row -> dailyMetrics.merge(row.naturalKey(), row, NormalizedDailyMetric::mergedWith));
    }

    @Override
    public void upsertDerivedMetric(DerivedMetric metric) {
        derivedMetrics.put(metric.userId() + ":" + metric.date(), metric);
    }
}

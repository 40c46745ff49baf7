package com.runsmart.garmin_sync_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.exception.GarminStorageException;
import com.runsmart.garmin_sync_engine.model.DerivedMetric;
import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcGarminAnalyticsRepository implements GarminAnalyticsRepository {

    private static final String UPSERT_ACTIVITY = """
        INSERT INTO garmin_activities
            (user_id, activity_id, start_time, sport, duration_s, distance_m, avg_hr, max_hr,
             avg_pace, elevation_gain_m, calories, source, raw_json, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), NOW())
        ON CONFLICT (user_id, activity_id) DO UPDATE SET
            start_time       = EXCLUDED.start_time,
            sport            = EXCLUDED.sport,
            duration_s       = EXCLUDED.duration_s,
            distance_m       = EXCLUDED.distance_m,
            avg_hr           = EXCLUDED.avg_hr,
            max_hr           = EXCLUDED.max_hr,
            avg_pace         = EXCLUDED.avg_pace,
            elevation_gain_m = EXCLUDED.elevation_gain_m,
            calories         = EXCLUDED.calories,
            source           = EXCLUDED.source,
            raw_json         = EXCLUDED.raw_json,
            updated_at       = NOW()
        """;

    private static final String UPSERT_DAILY_METRIC = """
        INSERT INTO garmin_daily_metrics
            (user_id, date, steps, sleep_score, sleep_duration_s, hrv, resting_hr, stress,
             body_battery, training_readiness, vo2max, weight_kg, calories, raw_json, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), NOW())
        ON CONFLICT (user_id, date) DO UPDATE SET
            steps              = COALESCE(EXCLUDED.steps, garmin_daily_metrics.steps),
            sleep_score        = COALESCE(EXCLUDED.sleep_score, garmin_daily_metrics.sleep_score),
            sleep_duration_s   = COALESCE(EXCLUDED.sleep_duration_s, garmin_daily_metrics.sleep_duration_s),
            hrv                = COALESCE(EXCLUDED.hrv, garmin_daily_metrics.hrv),
            resting_hr         = COALESCE(EXCLUDED.resting_hr, garmin_daily_metrics.resting_hr),
            stress             = COALESCE(EXCLUDED.stress, garmin_daily_metrics.stress),
            body_battery       = COALESCE(EXCLUDED.body_battery, garmin_daily_metrics.body_battery),
            training_readiness = COALESCE(EXCLUDED.training_readiness, garmin_daily_metrics.training_readiness),
            vo2max             = COALESCE(EXCLUDED.vo2max, garmin_daily_metrics.vo2max),
            weight_kg          = COALESCE(EXCLUDED.weight_kg, garmin_daily_metrics.weight_kg),
            calories           = COALESCE(EXCLUDED.calories, garmin_daily_metrics.calories),
            raw_json           = COALESCE(garmin_daily_metrics.raw_json, '{}'::jsonb) || EXCLUDED.raw_json,
            updated_at         = NOW()
        """;

    private static final String UPSERT_DERIVED_METRIC = """
        INSERT INTO training_derived_metrics
            (user_id, date, acute_load_7d, chronic_load_28d, acwr, monotony_7d, strain_7d,
             weekly_volume_m, readiness_score, readiness_state, drivers, confidence,
             confidence_reason, flags_json, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, CAST(? AS jsonb), NOW())
        ON CONFLICT (user_id, date) DO UPDATE SET
            acute_load_7d     = EXCLUDED.acute_load_7d,
            chronic_load_28d  = EXCLUDED.chronic_load_28d,
            acwr              = EXCLUDED.acwr,
            monotony_7d       = EXCLUDED.monotony_7d,
            strain_7d         = EXCLUDED.strain_7d,
            weekly_volume_m   = EXCLUDED.weekly_volume_m,
            readiness_score   = EXCLUDED.readiness_score,
            readiness_state   = EXCLUDED.readiness_state,
            drivers           = EXCLUDED.drivers,
            confidence        = EXCLUDED.confidence,
            confidence_reason = EXCLUDED.confidence_reason,
            flags_json        = EXCLUDED.flags_json,
            updated_at        = NOW()
        """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public void upsertActivities(List<NormalizedActivity> batch) {
        List<Object[]> args = new ArrayList<>(batch.size());
        for (NormalizedActivity a : batch) {
            args.add(new Object[]{
                    a.userId(), a.activityId(), timestamp(a.startTime()), a.sport(), a.durationS(),
                    a.distanceM(), a.avgHr(), a.maxHr(), a.avgPace(), a.elevationGainM(), a.calories(),
                    a.source(), json(a.raw())
            });
        }
        batchUpdate("garmin_activities", UPSERT_ACTIVITY, args);
    }

    @Override
    public void upsertDailyMetrics(List<NormalizedDailyMetric> batch) {
        List<Object[]> args = new ArrayList<>(batch.size());
        for (NormalizedDailyMetric m : batch) {
            args.add(new Object[]{
                    m.userId(), Date.valueOf(m.date()), m.steps(), m.sleepScore(), m.sleepDurationS(),
                    m.hrv(), m.restingHr(), m.stress(), m.bodyBattery(), m.trainingReadiness(),
                    m.vo2max(), m.weightKg(), m.calories(), m.raw() == null ? "{}" : json(m.raw())
            });
        }
        batchUpdate("garmin_daily_metrics", UPSERT_DAILY_METRIC, args);
    }

    @Override
    public void upsertDerivedMetric(DerivedMetric d) {
        try {
            jdbc.update(UPSERT_DERIVED_METRIC,
                    d.userId(), Date.valueOf(d.date()), d.acuteLoad7d(), d.chronicLoad28d(), d.acwr(),
                    d.monotony7d(), d.strain7d(), d.weeklyVolumeM(), d.readinessScore(), d.readinessState(),
                    json(d.drivers()), d.confidence(), d.confidenceReason(), json(d.flags()));
        } catch (DataAccessException e) {
            throw new GarminStorageException("Failed to upsert training_derived_metrics: " + e.getMessage(), e);
        }
    }

    private void batchUpdate(String table, String sql, List<Object[]> args) {
        if (args.isEmpty()) {
            return;
        }
        try {
            jdbc.batchUpdate(sql, args);
        } catch (DataAccessException e) {
            throw new GarminStorageException("Failed to upsert " + table + ": " + e.getMessage(), e);
        }
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GarminStorageException("Failed to serialize row payload", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}

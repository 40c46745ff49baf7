package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps Garmin summary JSON onto activity and daily-metric rows. Garmin renames fields between
 * products and firmware versions, so every logical field is read from an ordered list of
 * aliases. Never throws: rows that cannot be identified come back as {@code null}.
 */
@Component
public class GarminNormalizer {

    static final String SOURCE = "garmin";

    /** Durations above this are milliseconds. */
    private static final double DURATION_MS_THRESHOLD = 100_000;

    /** Weights above this are grams. */
    private static final double WEIGHT_GRAMS_THRESHOLD = 250;

    /** Order in which daily datasets are merged; later datasets win field by field. */
    private static final List<GarminDataset> DAILY_MERGE_ORDER = List.of(
            GarminDataset.SLEEPS,
            GarminDataset.DAILIES,
            GarminDataset.USER_METRICS,
            GarminDataset.BODY_COMPS,
            GarminDataset.HRV,
            GarminDataset.STRESS_DETAILS);

    public NormalizedActivity normalizeActivity(Long userId, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return null;
        }
        String activityId = JsonFields.firstText(raw, "activityId", "summaryId");
        if (activityId == null) {
            return null;
        }

        Instant startTime = JsonFields.firstEpochSeconds(raw, "startTimeInSeconds");
        if (startTime == null) {
            startTime = JsonFields.firstIsoInstant(raw, "startTimeGMT", "startTimeLocal");
        }

        Double durationRaw = JsonFields.firstDouble(raw, "durationInSeconds", "duration");
        Integer durationS = null;
        if (durationRaw != null) {
            durationS = JsonFields.roundToInt(durationRaw > DURATION_MS_THRESHOLD ? durationRaw / 1000 : durationRaw);
        }

        Double speed = JsonFields.firstDouble(raw, "averageSpeedInMetersPerSecond", "averageSpeed");
        Integer avgPace = speed != null && speed > 0 ? JsonFields.roundToInt(1000 / speed) : null;

        return new NormalizedActivity(
                userId,
                activityId,
                startTime,
                sport(raw),
                durationS,
                JsonFields.firstDouble(raw, "distanceInMeters", "distance"),
                JsonFields.firstInteger(raw, "averageHeartRateInBeatsPerMinute", "averageHR"),
                JsonFields.firstInteger(raw, "maxHeartRateInBeatsPerMinute", "maxHR"),
                avgPace,
                JsonFields.firstDouble(raw, "totalElevationGainInMeters", "elevationGain"),
                JsonFields.firstDouble(raw, "activeKilocalories", "calories"),
                SOURCE,
                raw);
    }

    public NormalizedDailyMetric normalizeDailyMetric(Long userId, GarminDataset dataset, JsonNode raw) {
        if (raw == null || !raw.isObject() || dataset == null || !dataset.isDailyMetricSource()) {
            return null;
        }
        LocalDate date = dailyDate(dataset, raw);
        if (date == null) {
            return null;
        }

        Integer steps = null;
        Double sleepScore = null;
        Integer sleepDurationS = null;
        Double hrv = null;
        Integer restingHr = null;
        Double stress = null;
        Integer bodyBattery = null;
        Integer trainingReadiness = null;
        Double vo2max = null;
        Double weightKg = null;
        Double calories = null;

        switch (dataset) {
            case SLEEPS -> {
                sleepDurationS = JsonFields.firstInteger(raw, "durationInSeconds", "totalSleepSeconds");
                sleepScore = JsonFields.firstDouble(raw, "overallSleepScore", "sleepScore",
                        "overallSleepScore.value", "sleepScores.overall.value");
            }
            case DAILIES -> {
                steps = JsonFields.firstInteger(raw, "steps", "totalSteps", "stepsCount");
                restingHr = JsonFields.firstInteger(raw,
                        "restingHeartRateInBeatsPerMinute", "restingHeartRate", "restingHeartRateBpm");
                stress = JsonFields.firstDouble(raw, "averageStressLevel", "stressLevel", "overallStressLevel");
                bodyBattery = JsonFields.firstInteger(raw, "bodyBattery", "bodyBatteryMostRecentValue");
                trainingReadiness = JsonFields.firstInteger(raw, "trainingReadiness", "trainingReadinessScore");
                calories = JsonFields.firstDouble(raw, "activeKilocalories", "calories");
            }
            case USER_METRICS -> {
                vo2max = JsonFields.firstDouble(raw, "vo2Max", "vo2max");
                weightKg = weightKg(JsonFields.firstDouble(raw, "weight", "bodyMassInKilograms"));
            }
            case BODY_COMPS -> weightKg = weightKg(JsonFields.firstDouble(raw, "weight", "bodyMassInGrams", "bodyMass"));
            case HRV -> hrv = JsonFields.firstDouble(raw, "hrvValue", "value", "dailyAvg", "lastNightAvg");
            case STRESS_DETAILS -> stress = JsonFields.firstDouble(raw,
                    "stressLevel", "averageStressLevel", "stressLevelValue");
            default -> {
                return null;
            }
        }

        ObjectNode rawByDataset = JsonNodeFactory.instance.objectNode();
        rawByDataset.putArray(dataset.key()).add(raw);

        return new NormalizedDailyMetric(userId, date, steps, sleepScore, sleepDurationS, hrv, restingHr,
                stress, bodyBattery, trainingReadiness, vo2max, weightKg, calories, rawByDataset);
    }

    /**
     * Normalizes every daily-metric dataset and merges the results into one row per date,
     * sorted by date.
     */
    public List<NormalizedDailyMetric> normalizeDailyMetrics(Long userId, Map<GarminDataset, List<JsonNode>> datasets) {
        if (datasets == null || datasets.isEmpty()) {
            return Collections.emptyList();
        }
        TreeMap<LocalDate, NormalizedDailyMetric> byDate = new TreeMap<>();
        for (GarminDataset dataset : DAILY_MERGE_ORDER) {
            for (JsonNode raw : datasets.getOrDefault(dataset, Collections.emptyList())) {
                NormalizedDailyMetric row = normalizeDailyMetric(userId, dataset, raw);
                if (row != null) {
                    byDate.merge(row.date(), row, NormalizedDailyMetric::mergedWith);
                }
            }
        }
        return new ArrayList<>(byDate.values());
    }

    public List<NormalizedActivity> normalizeActivities(Long userId, List<JsonNode> rows) {
        List<NormalizedActivity> activities = new ArrayList<>();
        if (rows == null) {
            return activities;
        }
        for (JsonNode raw : rows) {
            NormalizedActivity activity = normalizeActivity(userId, raw);
            if (activity != null) {
                activities.add(activity);
            }
        }
        return activities;
    }

    private static String sport(JsonNode raw) {
        String type = JsonFields.firstText(raw, "activityType.typeKey", "activityType");
        if (type == null) {
            return null;
        }
        return type.toLowerCase(Locale.ROOT).trim().replace(' ', '_');
    }

    private static LocalDate dailyDate(GarminDataset dataset, JsonNode raw) {
        LocalDate date;
        if (dataset == GarminDataset.USER_METRICS || dataset == GarminDataset.BODY_COMPS) {
            date = JsonFields.firstDate(raw, "calendarDate", "measurementDate", "date");
            if (date == null) {
                Instant measured = JsonFields.firstEpochSeconds(raw, "measurementTimeInSeconds");
                date = measured == null ? null : measured.atZone(ZoneOffset.UTC).toLocalDate();
            }
            return date;
        }
        date = JsonFields.firstDate(raw, "calendarDate", "date");
        if (date == null) {
            Instant start = JsonFields.firstEpochSeconds(raw, "startTimeInSeconds");
            date = start == null ? null : start.atZone(ZoneOffset.UTC).toLocalDate();
        }
        return date;
    }

    private static Double weightKg(Double value) {
        if (value == null) {
            return null;
        }
        double kg = value > WEIGHT_GRAMS_THRESHOLD ? value / 1000 : value;
        return BigDecimal.valueOf(kg).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

package com.runsmart.garmin_sync_engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;

/**
 * Daily wellness row keyed by {@code (userId, date)}. Several source datasets contribute to the
 * same day; {@link #mergedWith} combines them without letting a null erase a known value.
 *
 * @param raw source payloads keyed by dataset key, each an array
 */
public record NormalizedDailyMetric(
        Long userId,
        LocalDate date,
        Integer steps,
        Double sleepScore,
        Integer sleepDurationS,
        Double hrv,
        Integer restingHr,
        Double stress,
        Integer bodyBattery,
        Integer trainingReadiness,
        Double vo2max,
        Double weightKg,
        Double calories,
        ObjectNode raw) {

    public String naturalKey() {
        return userId + ":" + date;
    }

    public boolean hasAnyValue() {
        return steps != null || sleepScore != null || sleepDurationS != null || hrv != null
                || restingHr != null || stress != null || bodyBattery != null || trainingReadiness != null
                || vo2max != null || weightKg != null || calories != null;
    }

    /** Values present in {@code later} win; its nulls keep this row's values. */
    public NormalizedDailyMetric mergedWith(NormalizedDailyMetric later) {
        ObjectNode mergedRaw = raw != null ? raw.deepCopy() : JsonNodeFactory.instance.objectNode();
        if (later.raw != null) {
            later.raw.fields().forEachRemaining(entry -> {
                JsonNode existing = mergedRaw.get(entry.getKey());
                if (existing instanceof ArrayNode existingArray && entry.getValue().isArray()) {
                    existingArray.addAll((ArrayNode) entry.getValue().deepCopy());
                } else {
                    mergedRaw.set(entry.getKey(), entry.getValue().deepCopy());
                }
            });
        }
        return new NormalizedDailyMetric(
                userId,
                date,
                pick(later.steps, steps),
                pick(later.sleepScore, sleepScore),
                pick(later.sleepDurationS, sleepDurationS),
                pick(later.hrv, hrv),
                pick(later.restingHr, restingHr),
                pick(later.stress, stress),
                pick(later.bodyBattery, bodyBattery),
                pick(later.trainingReadiness, trainingReadiness),
                pick(later.vo2max, vo2max),
                pick(later.weightKg, weightKg),
                pick(later.calories, calories),
                mergedRaw);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}

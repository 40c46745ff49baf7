package com.runsmart.garmin_sync_engine.model;

import com.runsmart.garmin_sync_engine.metrics.ReadinessDriver;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One {@code training_derived_metrics} row, overwritten on {@code (userId, date)}.
 */
public record DerivedMetric(
        Long userId,
        LocalDate date,
        Double acuteLoad7d,
        Double chronicLoad28d,
        Double acwr,
        Double monotony7d,
        Double strain7d,
        Double weeklyVolumeM,
        Integer readinessScore,
        String readinessState,
        List<ReadinessDriver> drivers,
        String confidence,
        String confidenceReason,
        Map<String, Object> flags) {
}

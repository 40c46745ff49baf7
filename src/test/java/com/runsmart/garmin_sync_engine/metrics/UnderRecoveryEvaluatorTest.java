package com.runsmart.garmin_sync_engine.metrics;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnderRecoveryEvaluatorTest {

    private final UnderRecoveryEvaluator evaluator = new UnderRecoveryEvaluator();
    private final ReadinessBaseline baseline = new ReadinessBaseline(60.0, 50.0, 80.0, 30.0, 70.0, 25);
    private final LocalDate today = LocalDate.parse("2026-03-10");

    @Test
    void two_unfavourable_signals_flag_under_recovery() {
        UnderRecoverySignature signature = evaluator.evaluate(
                new DailySignalSample(today, 52.0, 56.0, 78.0, 32.0, 65.0), baseline);

        assertTrue(signature.flagged());
        assertEquals(2, signature.triggerCount());
        assertEquals(List.of("hrv_suppressed", "resting_hr_elevated"), signature.triggers());
        assertEquals("high", signature.confidence());
        assertEquals(UnderRecoveryEvaluator.FLAGGED_RECOMMENDATION, signature.recommendation());
    }

    @Test
    void single_outlier_is_not_enough() {
        UnderRecoverySignature signature = evaluator.evaluate(
                new DailySignalSample(today, 60.0, 50.0, 60.0, 30.0, 70.0), baseline);

        assertFalse(signature.flagged());
        assertEquals(List.of("sleep_score_low"), signature.triggers());
        assertEquals(UnderRecoveryEvaluator.CLEAR_RECOMMENDATION, signature.recommendation());
    }

    @Test
    void every_trigger_fires_on_a_bad_day() {
        UnderRecoverySignature signature = evaluator.evaluate(
                new DailySignalSample(today, 40.0, 58.0, 55.0, 45.0, 40.0), baseline);

        assertEquals(List.of("hrv_suppressed", "resting_hr_elevated", "sleep_score_low",
                "stress_elevated", "body_battery_low"), signature.triggers());
    }

    @Test
    void missing_values_never_trigger() {
        UnderRecoverySignature signature = evaluator.evaluate(
                new DailySignalSample(today, null, null, null, null, null), baseline);

        assertFalse(signature.flagged());
        assertEquals(0, signature.triggerCount());
    }

    @Test
    void confidence_follows_baseline_depth() {
        DailySignalSample sample = new DailySignalSample(today, 60.0, 50.0, 80.0, 30.0, 70.0);

        assertEquals("medium", evaluator.evaluate(sample, new ReadinessBaseline(60.0, 50.0, 80.0, 30.0, 70.0, 12)).confidence());
        assertEquals("low", evaluator.evaluate(sample, ReadinessBaseline.empty()).confidence());
    }
}

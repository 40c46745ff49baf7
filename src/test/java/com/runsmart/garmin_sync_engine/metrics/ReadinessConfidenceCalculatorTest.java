package com.runsmart.garmin_sync_engine.metrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessConfidenceCalculatorTest {

    private final ReadinessConfidenceCalculator calculator = new ReadinessConfidenceCalculator();
    private final Instant now = Instant.parse("2026-03-10T08:00:00Z");

    @Test
    void full_coverage_with_fresh_sync_is_high() {
        ReadinessConfidenceCalculator.Assessment assessment =
                calculator.assess(21, 4, now.minus(Duration.ofHours(3)), now);

        assertEquals(ReadinessConfidence.HIGH, assessment.confidence());
    }

    @Test
    void stale_sync_drops_to_medium() {
        ReadinessConfidenceCalculator.Assessment assessment =
                calculator.assess(28, 5, now.minus(Duration.ofHours(30)), now);

        assertEquals(ReadinessConfidence.MEDIUM, assessment.confidence());
    }

    @Test
    void no_signals_is_low_with_fixed_reason() {
        ReadinessConfidenceCalculator.Assessment assessment = calculator.assess(28, 0, now, now);

        assertEquals(ReadinessConfidence.LOW, assessment.confidence());
        assertEquals(ReadinessConfidenceCalculator.NO_SIGNALS_REASON, assessment.reason());
    }

    @Test
    void low_reason_names_the_first_missing_factor() {
        assertEquals("Only 1 readiness signal was available today.",
                calculator.assess(28, 1, now, now).reason());
        assertEquals("Baseline has only 4 days of data so far.",
                calculator.assess(4, 3, now, now).reason());
        assertEquals("Garmin data has not synced yet.",
                calculator.assess(15, 3, null, now).reason());
        assertEquals("Garmin data last synced 80 hours ago.",
                calculator.assess(15, 3, now.minus(Duration.ofHours(80)), now).reason());
    }

    @Test
    void sync_after_evaluation_time_is_not_fresh() {
        assertEquals(ReadinessConfidence.LOW,
                calculator.assess(28, 5, now.plus(Duration.ofHours(1)), now).confidence());
    }
}

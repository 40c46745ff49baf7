package com.runsmart.garmin_sync_engine.metrics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags under-recovery when several signals are off baseline in the unfavourable direction on
 * the same day. One outlier is never enough.
 */
@Component
public class UnderRecoveryEvaluator {

    public static final int MIN_TRIGGERS = 2;

    static final double HRV_DROP_PCT = 10;
    static final double RESTING_HR_RISE_BPM = 5;
    static final double SLEEP_DROP_POINTS = 10;
    static final double STRESS_RISE_POINTS = 10;
    static final double BODY_BATTERY_DROP_POINTS = 15;

    static final String FLAGGED_RECOMMENDATION =
            "Several recovery signals are below your usual range. Consider an easy day or rest.";
    static final String CLEAR_RECOMMENDATION = "No under-recovery pattern detected.";

    public UnderRecoverySignature evaluate(DailySignalSample today, ReadinessBaseline baseline) {
        List<String> triggers = new ArrayList<>();
        if (today != null && baseline != null) {
            Double hrv = today.hrv();
            if (hrv != null && baseline.hrv() != null && baseline.hrv() > 0
                    && (baseline.hrv() - hrv) / baseline.hrv() * 100 >= HRV_DROP_PCT) {
                triggers.add("hrv_suppressed");
            }
            if (exceeds(today.restingHr(), baseline.restingHr(), RESTING_HR_RISE_BPM)) {
                triggers.add("resting_hr_elevated");
            }
            if (exceeds(baseline.sleepScore(), today.sleepScore(), SLEEP_DROP_POINTS)) {
                triggers.add("sleep_score_low");
            }
            if (exceeds(today.stress(), baseline.stress(), STRESS_RISE_POINTS)) {
                triggers.add("stress_elevated");
            }
            if (exceeds(baseline.bodyBattery(), today.bodyBattery(), BODY_BATTERY_DROP_POINTS)) {
                triggers.add("body_battery_low");
            }
        }

        boolean flagged = triggers.size() >= MIN_TRIGGERS;
        return new UnderRecoverySignature(
                flagged,
                triggers.size(),
                List.copyOf(triggers),
                confidence(baseline == null ? 0 : baseline.sampleCount()).wireName(),
                flagged ? FLAGGED_RECOMMENDATION : CLEAR_RECOMMENDATION);
    }

    private static ReadinessConfidence confidence(int baselineSamples) {
        if (baselineSamples >= 21) {
            return ReadinessConfidence.HIGH;
        }
        return baselineSamples >= 10 ? ReadinessConfidence.MEDIUM : ReadinessConfidence.LOW;
    }

    /** {@code higher - lower >= margin}, false when either side is missing. */
    private static boolean exceeds(Double higher, Double lower, double margin) {
        return higher != null && lower != null && higher - lower >= margin;
    }
}

package com.runsmart.garmin_sync_engine.metrics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic readiness score. The latest sample is "today"; earlier samples form the
 * baseline pool. Nothing here reads the clock.
 */
@Component
public class ReadinessComputer {

    public static final int DEFAULT_SCORE = 50;

    private final BaselineCalculator baselineCalculator;
    private final ReadinessConfidenceCalculator confidenceCalculator;
    private final UnderRecoveryEvaluator underRecoveryEvaluator;

    public ReadinessComputer(BaselineCalculator baselineCalculator,
                             ReadinessConfidenceCalculator confidenceCalculator,
                             UnderRecoveryEvaluator underRecoveryEvaluator) {
        this.baselineCalculator = baselineCalculator;
        this.confidenceCalculator = confidenceCalculator;
        this.underRecoveryEvaluator = underRecoveryEvaluator;
    }

    private record SignalScore(Double score, String impact, String explanation) {
    }

    public ReadinessResult compute(ReadinessInput input) {
        List<DailySignalSample> sorted = (input.samples() == null ? List.<DailySignalSample>of() : input.samples())
                .stream()
                .sorted(Comparator.comparing(DailySignalSample::date))
                .toList();

        DailySignalSample today = sorted.isEmpty()
                ? new DailySignalSample(null, null, null, null, null, null)
                : sorted.get(sorted.size() - 1);
        ReadinessBaseline baseline = baselineCalculator.compute(sorted.subList(0, Math.max(0, sorted.size() - 1)));

        List<ReadinessDriver> drivers = new ArrayList<>();
        List<String> missingSignals = new ArrayList<>();
        double numerator = 0;
        double denominator = 0;

        for (ReadinessSignal signal : ReadinessSignal.values()) {
            Double value = today.value(signal);
            Double baselineValue = baseline.value(signal);
            SignalScore scored = score(signal, value, baselineValue);

            double contribution = scored.score() == null ? 0 : MetricMath.round(scored.score() * signal.weight(), 2);
            drivers.add(new ReadinessDriver(signal.key(), scored.impact(), value, baselineValue,
                    contribution, scored.explanation()));

            if (value == null) {
                missingSignals.add(signal.key());
            } else {
                numerator += contribution;
                denominator += signal.weight();
            }
        }

        int score = denominator > 0
                ? (int) MetricMath.clamp(Math.round(numerator / denominator), 0, 100)
                : DEFAULT_SCORE;

        ReadinessConfidenceCalculator.Assessment confidence = confidenceCalculator.assess(
                baseline.sampleCount(), ReadinessSignal.values().length - missingSignals.size(),
                input.lastSyncAt(), input.evaluatedAt());

        return new ReadinessResult(
                today.date(),
                score,
                state(score),
                List.copyOf(drivers),
                confidence.confidence().wireName(),
                confidence.reason(),
                input.lastSyncAt(),
                List.copyOf(missingSignals),
                underRecoveryEvaluator.evaluate(today, baseline),
                input.load() == null ? TrainingLoad.none() : input.load(),
                baseline);
    }

    static String state(int score) {
        if (score >= 75) {
            return "ready";
        }
        return score >= 55 ? "steady" : "caution";
    }

    private static SignalScore score(ReadinessSignal signal, Double value, Double baseline) {
        if (value == null) {
            return new SignalScore(null, "missing", capitalize(signal.label()) + " is missing today.");
        }
        switch (signal) {
            case SLEEP_SCORE: {
                double score = MetricMath.clamp(value, 0, 100);
                return new SignalScore(score, band(score, 70, 55), "Sleep score is " + Math.round(score) + ".");
            }
            case BODY_BATTERY: {
                double score = MetricMath.clamp(value, 0, 100);
                return new SignalScore(score, band(score, 60, 45), "Body battery is " + Math.round(score) + ".");
            }
            case STRESS: {
                double score = MetricMath.clamp(100 - value, 0, 100);
                return new SignalScore(score, band(score, 60, 45),
                        "Stress is " + Math.round(value) + " (lower is better).");
            }
            case HRV: {
                Double deltaPct = baseline == null || baseline == 0 ? null : (value - baseline) / baseline * 100;
                double score = MetricMath.clamp(50 + (deltaPct == null ? 0 : deltaPct) * 2.5, 0, 100);
                if (deltaPct == null) {
                    return new SignalScore(score, "neutral", "HRV is " + Math.round(value) + " with no baseline yet.");
                }
                String impact = deltaPct >= 6 ? "positive" : deltaPct <= -6 ? "negative" : "neutral";
                return new SignalScore(score, impact, "HRV is " + Math.round(Math.abs(deltaPct)) + "% "
                        + (deltaPct >= 0 ? "above" : "below") + " baseline.");
            }
            default: {
                // resting heart rate: lower than baseline is good
                if (baseline == null) {
                    return new SignalScore(50.0, "neutral",
                            "Resting HR is " + Math.round(value) + " with no baseline yet.");
                }
                double delta = baseline - value;
                double score = MetricMath.clamp(50 + delta * 8, 0, 100);
                String impact = delta >= 3 ? "positive" : delta <= -3 ? "negative" : "neutral";
                return new SignalScore(score, impact, "Resting HR is " + Math.round(Math.abs(delta)) + " bpm "
                        + (delta >= 0 ? "below" : "above") + " baseline.");
            }
        }
    }

    private static String band(double score, double positiveFrom, double neutralFrom) {
        if (score >= positiveFrom) {
            return "positive";
        }
        return score >= neutralFrom ? "neutral" : "negative";
    }

    private static String capitalize(String text) {
        if (text.equals("hrv")) {
            return "HRV";
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}

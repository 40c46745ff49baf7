package com.runsmart.garmin_sync_engine.metrics;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Trailing rolling baseline over the most recent {@value #WINDOW} samples. Missing values are
 * skipped rather than counted as zero.
 */
@Component
public class BaselineCalculator {

    public static final int WINDOW = 28;

    /**
     * @param pool prior samples, excluding the day being scored; any order
     */
    public ReadinessBaseline compute(List<DailySignalSample> pool) {
        if (pool == null || pool.isEmpty()) {
            return ReadinessBaseline.empty();
        }
        List<DailySignalSample> sorted = pool.stream()
                .sorted(Comparator.comparing(DailySignalSample::date))
                .toList();
        List<DailySignalSample> window = sorted.subList(Math.max(0, sorted.size() - WINDOW), sorted.size());

        Map<ReadinessSignal, Double> averages = new EnumMap<>(ReadinessSignal.class);
        for (ReadinessSignal signal : ReadinessSignal.values()) {
            double sum = 0;
            int count = 0;
            for (DailySignalSample sample : window) {
                Double value = sample.value(signal);
                if (value != null) {
                    sum += value;
                    count++;
                }
            }
            averages.put(signal, count == 0 ? null : MetricMath.round(sum / count, 2));
        }

        int sampleCount = (int) window.stream().filter(sample -> sample.availableSignals() > 0).count();
        return new ReadinessBaseline(
                averages.get(ReadinessSignal.HRV),
                averages.get(ReadinessSignal.RESTING_HR),
                averages.get(ReadinessSignal.SLEEP_SCORE),
                averages.get(ReadinessSignal.STRESS),
                averages.get(ReadinessSignal.BODY_BATTERY),
                sampleCount);
    }
}

package com.runsmart.garmin_sync_engine.metrics;

import com.runsmart.garmin_sync_engine.config.GarminProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Acute:chronic workload ratio over a 28-day window ending on a given date.
 * <p>
 * Internal load per activity is {@code duration * clamp(avgHR / thresholdHR, 0.5, 2)}, or the
 * bare duration when heart rate is unknown. Loads are summed per UTC day; acute and chronic
 * loads are the 7- and 28-day daily means.
 */
@Component
public class AcwrCalculator {

    public static final int WINDOW_DAYS = 28;
    public static final int ACUTE_DAYS = 7;

    static final String ELEVATED_FLAG = "Load may be elevated, consider an easy day";
    static final String MONOTONY_FLAG = "High 7-day monotony may indicate low load variation";

    private final int thresholdHeartRate;

    @Autowired
    public AcwrCalculator(GarminProperties properties) {
        this(properties.getThresholdHeartRate());
    }

    public AcwrCalculator(int thresholdHeartRate) {
        this.thresholdHeartRate = thresholdHeartRate;
    }

    public AcwrMetrics compute(List<ActivityLoadSample> activities, LocalDate endDate) {
        LocalDate startDate = endDate.minusDays(WINDOW_DAYS - 1);
        Map<LocalDate, Double> loadByDate = new HashMap<>();
        Map<LocalDate, Double> distanceByDate = new HashMap<>();

        for (ActivityLoadSample activity : activities) {
            if (activity.startTime() == null) {
                continue;
            }
            LocalDate day = activity.startTime().atZone(ZoneOffset.UTC).toLocalDate();
            if (day.isBefore(startDate) || day.isAfter(endDate)) {
                continue;
            }
            double load = internalLoad(activity);
            if (load > 0) {
                loadByDate.merge(day, load, Double::sum);
            }
            if (activity.distanceMeters() != null && activity.distanceMeters() > 0) {
                distanceByDate.merge(day, activity.distanceMeters(), Double::sum);
            }
        }

        double[] dailyLoads28d = new double[WINDOW_DAYS];
        double weeklyVolume = 0;
        for (int i = 0; i < WINDOW_DAYS; i++) {
            LocalDate day = startDate.plusDays(i);
            dailyLoads28d[i] = MetricMath.round(loadByDate.getOrDefault(day, 0.0), 4);
            if (i >= WINDOW_DAYS - ACUTE_DAYS) {
                weeklyVolume += distanceByDate.getOrDefault(day, 0.0);
            }
        }
        double[] dailyLoads7d = Arrays.copyOfRange(dailyLoads28d, WINDOW_DAYS - ACUTE_DAYS, WINDOW_DAYS);
        int dataPointsUsed = (int) Arrays.stream(dailyLoads28d).filter(load -> load > 0).count();

        double acute = MetricMath.round(MetricMath.mean(dailyLoads7d), 2);
        double chronic = MetricMath.round(MetricMath.mean(dailyLoads28d), 2);
        Double acwr = chronic > 0 ? MetricMath.round(acute / chronic, 3) : null;
        double stdDev = MetricMath.standardDeviation(dailyLoads7d);
        Double monotony = stdDev > 0 ? MetricMath.round(acute / stdDev, 3) : null;
        double strain = MetricMath.round(Arrays.stream(dailyLoads7d).sum() * (monotony == null ? 0 : monotony), 2);
        Double weeklyVolumeMeters = weeklyVolume > 0 ? MetricMath.round(weeklyVolume, 2) : null;

        int missingDays = WINDOW_DAYS - dataPointsUsed;
        String evidenceConfidence = evidenceConfidence(dataPointsUsed);
        List<String> flags = new ArrayList<>();
        if (missingDays > 0) {
            flags.add("Missing training data for " + missingDays + " days");
        }
        if (evidenceConfidence.equals("low")) {
            flags.add("Low data confidence");
        }
        if (acwr != null && acwr > 1.3) {
            flags.add(ELEVATED_FLAG);
        }
        if (monotony != null && monotony >= 2) {
            flags.add(MONOTONY_FLAG);
        }

        return new AcwrMetrics(endDate, acute, chronic, acwr, monotony, strain, weeklyVolumeMeters,
                zone(acwr), dataPointsUsed, missingDays, evidenceConfidence, List.copyOf(flags));
    }

    static String zone(Double acwr) {
        if (acwr == null || acwr < 0.8) {
            return "underload";
        }
        if (acwr <= 1.3) {
            return "sweet_zone";
        }
        return acwr <= 1.5 ? "elevated" : "high";
    }

    private double internalLoad(ActivityLoadSample activity) {
        Integer duration = activity.durationSeconds();
        if (duration == null || duration <= 0) {
            return 0;
        }
        double intensity = 1;
        Integer avgHr = activity.averageHeartRate();
        if (avgHr != null && avgHr > 0 && thresholdHeartRate > 0) {
            intensity = MetricMath.clamp((double) avgHr / thresholdHeartRate, 0.5, 2);
        }
        return duration * intensity;
    }

    private static String evidenceConfidence(int dataPointsUsed) {
        if (dataPointsUsed >= 21) {
            return "high";
        }
        return dataPointsUsed < 7 ? "low" : "medium";
    }
}

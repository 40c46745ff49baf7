package com.runsmart.garmin_sync_engine.metrics;

import java.time.LocalDate;
import java.util.List;

/**
 * @param zone one of {@code underload}, {@code sweet_zone}, {@code elevated}, {@code high}
 * @param dataPointsUsed days in the 28-day window with any load
 */
public record AcwrMetrics(
        LocalDate endDate,
        double acuteLoad7d,
        double chronicLoad28d,
        Double acwr,
        Double monotony7d,
        double strain7d,
        Double weeklyVolumeMeters7d,
        String zone,
        int dataPointsUsed,
        int missingDays,
        String evidenceConfidence,
        List<String> flags) {

    public TrainingLoad toTrainingLoad() {
        return new TrainingLoad(acuteLoad7d, chronicLoad28d, acwr);
    }
}

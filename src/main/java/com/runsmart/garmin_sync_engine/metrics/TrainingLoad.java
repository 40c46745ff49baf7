package com.runsmart.garmin_sync_engine.metrics;

public record TrainingLoad(Double acuteLoad7d, Double chronicLoad28d, Double acwr) {

    public static TrainingLoad none() {
        return new TrainingLoad(null, null, null);
    }
}

package com.runsmart.garmin_sync_engine.metrics;

final class MetricMath {

    private MetricMath() {
    }

    static double round(double value, int precision) {
        double factor = Math.pow(10, precision);
        return Math.round(value * factor) / factor;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total / values.length;
    }

    /** Population standard deviation. */
    static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double average = mean(values);
        double variance = 0;
        for (double value : values) {
            variance += (value - average) * (value - average);
        }
        return Math.sqrt(variance / values.length);
    }
}

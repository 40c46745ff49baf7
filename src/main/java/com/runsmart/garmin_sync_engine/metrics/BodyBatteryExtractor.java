package com.runsmart.garmin_sync_engine.metrics;

import com.runsmart.garmin_sync_engine.model.GarminDailyMetric;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Body Battery time series from stored daily rows. Intraday values come from the
 * {@code timeOffsetBodyBatteryValues} of stress-detail payloads; days without them fall back to
 * the daily {@code body_battery} value at UTC midnight.
 */
@Component
public class BodyBatteryExtractor {

    public List<BodyBatterySample> extract(List<GarminDailyMetric> rows) {
        TreeMap<Instant, Integer> series = new TreeMap<>();
        Set<LocalDate> daysWithIntraday = new HashSet<>();

        for (GarminDailyMetric row : rows) {
            Map<String, Object> raw = row.getRawJson();
            Object details = raw == null ? null : raw.get("stressDetails");
            if (!(details instanceof List<?> detailList)) {
                continue;
            }
            for (Object detail : detailList) {
                if (!(detail instanceof Map<?, ?> detailMap)) {
                    continue;
                }
                Double start = number(detailMap.get("startTimeInSeconds"));
                Object offsets = detailMap.get("timeOffsetBodyBatteryValues");
                if (start == null || !(offsets instanceof Map<?, ?> offsetMap)) {
                    continue;
                }
                for (Map.Entry<?, ?> entry : offsetMap.entrySet()) {
                    Double offset = number(entry.getKey());
                    if (offset == null) {
                        continue;
                    }
                    Instant at = JsonFields.epochSeconds((double) (start.longValue() + offset.longValue()));
                    Integer value = JsonFields.roundToInt(number(entry.getValue()));
                    if (at == null || value == null) {
                        continue;
                    }
                    series.put(at, value);
                    daysWithIntraday.add(row.getDate());
                }
            }
        }

        for (GarminDailyMetric row : rows) {
            if (row.getBodyBattery() != null && row.getDate() != null && !daysWithIntraday.contains(row.getDate())) {
                series.putIfAbsent(row.getDate().atStartOfDay(ZoneOffset.UTC).toInstant(), row.getBodyBattery());
            }
        }

        List<BodyBatterySample> samples = new ArrayList<>();
        series.forEach((at, value) -> samples.add(new BodyBatterySample(at, value)));
        return samples;
    }

    /** Flag-ready summary: sample count plus latest, lowest and highest values. */
    public Map<String, Object> summarize(List<BodyBatterySample> samples) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("sampleCount", samples.size());
        if (samples.isEmpty()) {
            return summary;
        }
        BodyBatterySample latest = samples.get(samples.size() - 1);
        summary.put("latest", latest.value());
        summary.put("latestAt", latest.at().toString());
        summary.put("lowest", samples.stream().mapToInt(BodyBatterySample::value).min().orElse(latest.value()));
        summary.put("highest", samples.stream().mapToInt(BodyBatterySample::value).max().orElse(latest.value()));
        return summary;
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;
import com.runsmart.garmin_sync_engine.repository.GarminAnalyticsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Writes normalized rows. Duplicates inside one call collapse to the last occurrence, then the
 * rows go out in chunks of {@value #CHUNK_SIZE}.
 */
@Service
public class GarminAnalyticsStore {
    private static final Logger logger = LoggerFactory.getLogger(GarminAnalyticsStore.class);

    static final int CHUNK_SIZE = 500;

    private final GarminAnalyticsRepository analyticsRepository;

    public GarminAnalyticsStore(GarminAnalyticsRepository analyticsRepository) {
        this.analyticsRepository = analyticsRepository;
    }

    /**
     * @return number of distinct activities written
     * @throws com.runsmart.garmin_sync_engine.exception.GarminStorageException when a chunk fails
     */
    public int upsertActivities(List<NormalizedActivity> rows) {
        List<NormalizedActivity> deduped = dedupe(rows, NormalizedActivity::naturalKey);
        writeInChunks(deduped, analyticsRepository::upsertActivities);
        logger.debug("Upserted {} activities ({} submitted)", deduped.size(), rows.size());
        return deduped.size();
    }

    /**
     * @return number of distinct user-days written
     */
    public int upsertDailyMetrics(List<NormalizedDailyMetric> rows) {
        List<NormalizedDailyMetric> deduped = dedupe(rows, NormalizedDailyMetric::naturalKey);
        writeInChunks(deduped, analyticsRepository::upsertDailyMetrics);
        logger.debug("Upserted {} daily metric rows ({} submitted)", deduped.size(), rows.size());
        return deduped.size();
    }

    static <T> List<T> dedupe(List<T> rows, Function<T, String> key) {
        Map<String, T> byKey = new LinkedHashMap<>();
        for (T row : rows) {
            byKey.put(key.apply(row), row);
        }
        return new ArrayList<>(byKey.values());
    }

    private static <T> void writeInChunks(List<T> rows, Consumer<List<T>> writer) {
        for (int from = 0; from < rows.size(); from += CHUNK_SIZE) {
            writer.accept(rows.subList(from, Math.min(rows.size(), from + CHUNK_SIZE)));
        }
    }
}

package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import com.runsmart.garmin_sync_engine.repository.GarminExportRecordRepository;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw audit trail of everything Garmin sent us, and the cache the sync reads before falling
 * back to the device API. Rows are stored as delivered and never deduplicated here.
 */
@Service
public class GarminExportStore {
    private static final Logger logger = LoggerFactory.getLogger(GarminExportStore.class);

    static final int READ_PAGE_SIZE = 1000;
    static final int MAX_READ_ROWS = 20_000;
    static final Duration DEFAULT_HISTORY = Duration.ofDays(56);

    private static final String[] SUMMARY_ID_FIELDS = {
            "summaryId", "activityId", "sleepSummaryId", "calendarDate", "startTimeInSeconds", "startTimeGMT", "date"
    };
    private static final String[] GARMIN_USER_ID_FIELDS = {"userId", "userID", "ownerUserId", "garminUserId"};
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final GarminExportRecordRepository exportRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GarminExportStore(GarminExportRecordRepository exportRecordRepository, ObjectMapper objectMapper, Clock clock) {
        this.exportRecordRepository = exportRecordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param garminUserIds distinct Garmin users among the stored rows
     */
    public record StoreResult(boolean ok, int storedRows, int droppedRows, String storeError, Set<String> garminUserIds) {
    }

    public record ReadResult(boolean ok, Map<GarminDataset, List<JsonNode>> rowsByDataset, int totalRows,
                             boolean truncated, String storeError) {

        public List<JsonNode> rows(GarminDataset dataset) {
            return rowsByDataset.getOrDefault(dataset, Collections.emptyList());
        }
    }

    /**
     * Appends rows for one dataset. Rows without a resolvable Garmin user id, or with a start
     * time outside the representable range, are dropped and counted; a storage failure drops
     * the whole call.
     */
    public StoreResult storeRows(GarminDataset dataset, List<JsonNode> rows,
                                 GarminExportRecord.ExportSource source, String fallbackGarminUserId) {
        Instant receivedAt = clock.instant();
        List<GarminExportRecord> records = new ArrayList<>();
        int dropped = 0;

        for (int index = 0; index < rows.size(); index++) {
            JsonNode row = rows.get(index);
            String garminUserId = JsonFields.firstText(row, GARMIN_USER_ID_FIELDS);
            if (garminUserId == null) {
                garminUserId = fallbackGarminUserId;
            }
            if (garminUserId == null || garminUserId.isBlank() || hasUnusableStartTime(row)) {
                dropped++;
                continue;
            }

            GarminExportRecord record = new GarminExportRecord();
            record.setGarminUserId(garminUserId);
            record.setDatasetKey(dataset.key());
            record.setSummaryId(summaryId(dataset, row, index));
            record.setSource(source);
            record.setRecordedAt(recordedAt(row));
            record.setReceivedAt(receivedAt);
            record.setPayload(objectMapper.convertValue(row, PAYLOAD_TYPE));
            records.add(record);
        }

        if (dropped > 0) {
            logger.warn("Dropped {} {} rows without a Garmin user id or a usable start time", dropped, dataset.key());
        }
        if (records.isEmpty()) {
            return new StoreResult(true, 0, dropped, null, Set.of());
        }

        try {
            exportRecordRepository.saveAll(records);
        } catch (DataAccessException e) {
            logger.error("Failed to store {} {} export rows: {}", records.size(), dataset.key(), e.getMessage());
            return new StoreResult(false, 0, rows.size(), e.getMessage(), Set.of());
        }
        Set<String> garminUserIds = new LinkedHashSet<>();
        records.forEach(record -> garminUserIds.add(record.getGarminUserId()));
        return new StoreResult(true, records.size(), dropped, null, garminUserIds);
    }

    /**
     * Rows received for a Garmin user since {@code since} (default 56 days), grouped by dataset
     * in arrival order, capped at {@value #MAX_READ_ROWS} rows.
     */
    public ReadResult readRows(String garminUserId, Instant since) {
        Instant from = since != null ? since : clock.instant().minus(DEFAULT_HISTORY);
        List<GarminExportRecord> records = new ArrayList<>();
        boolean truncated = false;

        try {
            int page = 0;
            while (records.size() < MAX_READ_ROWS) {
                List<GarminExportRecord> pageRows = exportRecordRepository
                        .findByGarminUserIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
                                garminUserId, from, PageRequest.of(page, READ_PAGE_SIZE));
                records.addAll(pageRows);
                if (pageRows.size() < READ_PAGE_SIZE) {
                    break;
                }
                page++;
            }
        } catch (DataAccessException e) {
            logger.error("Failed to read export rows for Garmin user {}: {}", garminUserId, e.getMessage());
            return new ReadResult(false, Collections.emptyMap(), 0, false, e.getMessage());
        }

        if (records.size() >= MAX_READ_ROWS) {
            truncated = true;
            logger.warn("Export read for Garmin user {} hit the {} row cap", garminUserId, MAX_READ_ROWS);
            records = new ArrayList<>(records.subList(0, MAX_READ_ROWS));
        }
        // newest first from storage; oldest first so later rows win downstream
        Collections.reverse(records);

        Map<GarminDataset, List<JsonNode>> grouped = new EnumMap<>(GarminDataset.class);
        for (GarminExportRecord record : records) {
            GarminDataset.fromKey(record.getDatasetKey()).ifPresent(dataset ->
                    grouped.computeIfAbsent(dataset, key -> new ArrayList<>())
                            .add(objectMapper.valueToTree(record.getPayload())));
        }
        return new ReadResult(true, grouped, records.size(), truncated, null);
    }

    private static String summaryId(GarminDataset dataset, JsonNode row, int index) {
        for (String field : SUMMARY_ID_FIELDS) {
            String value = JsonFields.firstText(row, field);
            if (value != null) {
                return dataset.key() + ":" + value;
            }
        }
        return dataset.key() + ":row-" + index + "-" + Integer.toHexString(row.toString().hashCode());
    }

    private static boolean hasUnusableStartTime(JsonNode row) {
        Double seconds = JsonFields.firstDouble(row, "startTimeInSeconds");
        return seconds != null && JsonFields.epochSeconds(seconds) == null;
    }

    private static Instant recordedAt(JsonNode row) {
        Instant fromSeconds = JsonFields.firstEpochSeconds(row, "startTimeInSeconds");
        if (fromSeconds != null) {
            return fromSeconds;
        }
        LocalDate calendarDate = JsonFields.firstDate(row, "calendarDate");
        if (calendarDate != null) {
            return calendarDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return JsonFields.firstIsoInstant(row, "startTimeGMT");
    }
}

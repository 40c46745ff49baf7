package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import com.runsmart.garmin_sync_engine.repository.GarminExportRecordRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GarminExportStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GarminExportRecordRepository repository = mock(GarminExportRecordRepository.class);
    private final Instant now = Instant.parse("2026-03-10T08:00:00Z");
    private final GarminExportStore store =
            new GarminExportStore(repository, objectMapper, Clock.fixed(now, ZoneOffset.UTC));

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private GarminExportRecord record(String dataset, String payload, Instant receivedAt) {
        GarminExportRecord record = new GarminExportRecord();
        record.setGarminUserId("g-1");
        record.setDatasetKey(dataset);
        record.setReceivedAt(receivedAt);
        record.setPayload(Map.<String, Object>of("calendarDate", payload));
        return record;
    }

    @Test
    @SuppressWarnings("unchecked")
    void rows_without_user_id_are_dropped_and_rest_stored() throws Exception {
        GarminExportStore.StoreResult result = store.storeRows(GarminDataset.DAILIES, List.of(
                json("{\"userId\": \"g-1\", \"summaryId\": \"d-1\", \"calendarDate\": \"2026-03-09\"}"),
                json("{\"summaryId\": \"d-2\"}")), GarminExportRecord.ExportSource.PUSH, null);

        assertTrue(result.ok());
        assertEquals(1, result.storedRows());
        assertEquals(1, result.droppedRows());
        assertEquals(Set.of("g-1"), result.garminUserIds());

        ArgumentCaptor<List<GarminExportRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        GarminExportRecord stored = saved.getValue().get(0);
        assertEquals("dailies:d-1", stored.getSummaryId());
        assertEquals(GarminExportRecord.ExportSource.PUSH, stored.getSource());
        assertEquals(now, stored.getReceivedAt());
        assertEquals(Instant.parse("2026-03-09T00:00:00Z"), stored.getRecordedAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void row_with_out_of_range_start_time_is_dropped_not_thrown() throws Exception {
        GarminExportStore.StoreResult result = store.storeRows(GarminDataset.ACTIVITIES, List.of(
                json("{\"userId\": \"g-1\", \"activityId\": \"a-1\", \"startTimeInSeconds\": 1773100800}"),
                json("{\"userId\": \"g-1\", \"activityId\": \"a-2\", \"startTimeInSeconds\": 1e20}")),
                GarminExportRecord.ExportSource.PUSH, null);

        assertTrue(result.ok());
        assertEquals(1, result.storedRows());
        assertEquals(1, result.droppedRows());

        ArgumentCaptor<List<GarminExportRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        assertEquals("activities:a-1", saved.getValue().get(0).getSummaryId());
        assertEquals(Instant.ofEpochSecond(1773100800L), saved.getValue().get(0).getRecordedAt());
    }

    @Test
    void fallback_user_id_is_used_for_pulled_rows() throws Exception {
        GarminExportStore.StoreResult result = store.storeRows(GarminDataset.SLEEPS,
                List.of(json("{\"startTimeInSeconds\": 1773100800}")),
                GarminExportRecord.ExportSource.PING_PULL, "g-9");

        assertEquals(1, result.storedRows());
        assertEquals(Set.of("g-9"), result.garminUserIds());
    }

    @Test
    void storage_failure_is_reported_not_thrown() throws Exception {
        when(repository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

        GarminExportStore.StoreResult result = store.storeRows(GarminDataset.DAILIES,
                List.of(json("{\"userId\": \"g-1\"}")), GarminExportRecord.ExportSource.PUSH, null);

        assertFalse(result.ok());
        assertEquals(0, result.storedRows());
        assertEquals("db down", result.storeError());
    }

    @Test
    void read_returns_rows_oldest_first_grouped_by_dataset() {
        when(repository.findByGarminUserIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
                eq("g-1"), any(Instant.class), any(Pageable.class)))
                .thenReturn(List.of(
                        record("dailies", "2026-03-09", now.minusSeconds(10)),
                        record("sleeps", "2026-03-09", now.minusSeconds(20)),
                        record("dailies", "2026-03-08", now.minusSeconds(30)),
                        record("unknownDataset", "2026-03-08", now.minusSeconds(40))));

        GarminExportStore.ReadResult result = store.readRows("g-1", null);

        assertTrue(result.ok());
        assertEquals(4, result.totalRows());
        assertFalse(result.truncated());
        List<JsonNode> dailies = result.rows(GarminDataset.DAILIES);
        assertEquals(2, dailies.size());
        assertEquals("2026-03-08", dailies.get(0).get("calendarDate").asText());
        assertEquals(1, result.rows(GarminDataset.SLEEPS).size());
        assertTrue(result.rows(GarminDataset.HRV).isEmpty());
        verify(repository).findByGarminUserIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
                eq("g-1"), eq(now.minus(GarminExportStore.DEFAULT_HISTORY)), any(Pageable.class));
    }

    @Test
    void read_failure_is_reported() {
        when(repository.findByGarminUserIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
                anyString(), any(Instant.class), any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        GarminExportStore.ReadResult result = store.readRows("g-1", now.minusSeconds(3600));

        assertFalse(result.ok());
        assertEquals("timeout", result.storeError());
        assertTrue(result.rows(GarminDataset.DAILIES).isEmpty());
    }
}

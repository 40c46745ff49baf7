package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import com.runsmart.garmin_sync_engine.exception.GarminStorageException;
import com.runsmart.garmin_sync_engine.exception.GarminUpstreamException;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.model.SyncExecution;
import com.runsmart.garmin_sync_engine.model.SyncPlan;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.repository.GarminAnalyticsRepository;
import com.runsmart.garmin_sync_engine.repository.InMemoryGarminAnalyticsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GarminSyncExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Instant now = Instant.parse("2026-03-10T08:00:00Z");
    private final SyncPlan plan = new SyncPlan(1L, SyncTrigger.MANUAL,
            now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(30)), now, null);

    private final GarminTokenStore tokenStore = mock(GarminTokenStore.class);
    private final GarminApiClient apiClient = mock(GarminApiClient.class);
    private final GarminExportStore exportStore = mock(GarminExportStore.class);
    private final GarminQueuePublisher queuePublisher = mock(GarminQueuePublisher.class);
    private final InMemoryGarminAnalyticsRepository analyticsRepository = new InMemoryGarminAnalyticsRepository();

    private GarminSyncExecutor executor;

    @BeforeEach
    void setUp() {
        executor = executorWith(analyticsRepository);
        when(tokenStore.getValidAccessToken(1L)).thenReturn("access");
        when(apiClient.fetchGarminUserId("access")).thenReturn("g-1");
        when(apiClient.fetchPermissions("access")).thenReturn(List.of("ACTIVITY_EXPORT", "HEALTH_EXPORT"));
        when(apiClient.fetchSummaries(anyString(), any(), any(), any(), any())).thenReturn(List.of());
        when(exportStore.storeRows(any(), anyList(), any(), any()))
                .thenReturn(new GarminExportStore.StoreResult(true, 1, 0, null, Set.of("g-1")));
        when(queuePublisher.enqueueDerive(any())).thenReturn(new QueueResult(true, "job", null));
    }

    private GarminSyncExecutor executorWith(GarminAnalyticsRepository repository) {
        return new GarminSyncExecutor(tokenStore, apiClient, exportStore, new GarminNormalizer(),
                new GarminAnalyticsStore(repository), queuePublisher, Clock.fixed(now, ZoneOffset.UTC));
    }

    private JsonNode activity(String id, Instant start) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("activityId", id);
        node.put("startTimeInSeconds", start.getEpochSecond());
        node.put("durationInSeconds", 1800);
        return node;
    }

    private JsonNode daily(String date) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("calendarDate", date);
        node.put("steps", 8000);
        return node;
    }

    private void cacheReturns(Map<GarminDataset, List<JsonNode>> rows) {
        int total = rows.values().stream().mapToInt(List::size).sum();
        when(exportStore.readRows(eq("g-1"), any()))
                .thenReturn(new GarminExportStore.ReadResult(true, rows, total, false, null));
    }

    @Test
    void cached_rows_are_upserted_and_derive_is_queued() {
        Map<GarminDataset, List<JsonNode>> cached = new EnumMap<>(GarminDataset.class);
        cached.put(GarminDataset.ACTIVITIES, List.of(
                activity("a1", now.minus(Duration.ofDays(2))),
                activity("old", now.minus(Duration.ofDays(45)))));
        cached.put(GarminDataset.DAILIES, List.of(daily("2026-03-08"), daily("2026-03-09")));
        cacheReturns(cached);

        SyncExecution execution = executor.execute(plan);

        assertEquals(200, execution.status());
        assertEquals(1, execution.activitiesUpserted());
        assertEquals(2, execution.dailyMetricsUpserted());
        assertTrue(execution.deriveQueued());
        verify(apiClient, never()).fetchSummaries(anyString(), eq(GarminDataset.ACTIVITIES), any(), any(), any());
        verify(apiClient).fetchSummaries("access", GarminDataset.SLEEPS, plan.dailySince(), now,
                GarminApiClient.PullMode.UPLOAD);
        verify(tokenStore).markSyncSuccess(1L, now);

        ArgumentCaptor<DeriveJobPayload> derive = ArgumentCaptor.forClass(DeriveJobPayload.class);
        verify(queuePublisher).enqueueDerive(derive.capture());
        assertEquals(1L, derive.getValue().userId());
        assertEquals("sync", derive.getValue().source());
    }

    @Test
    void empty_cache_pulls_from_api_and_caches_rows() {
        cacheReturns(Map.of());
        when(apiClient.fetchPermissions("access")).thenReturn(List.of("ACTIVITY_EXPORT"));
        List<JsonNode> pulled = List.of(activity("a1", now.minus(Duration.ofDays(1))));
        when(apiClient.fetchSummaries("access", GarminDataset.ACTIVITIES, plan.activitySince(), now,
                GarminApiClient.PullMode.UPLOAD)).thenReturn(pulled);

        SyncExecution execution = executor.execute(plan);

        assertEquals(200, execution.status());
        assertEquals(1, execution.activitiesUpserted());
        verify(exportStore).storeRows(GarminDataset.ACTIVITIES, pulled, GarminExportRecord.ExportSource.API_PULL, "g-1");
        assertTrue(execution.notices().stream().anyMatch(n -> n.startsWith("dailies skipped")));
        assertTrue(execution.notices().stream().anyMatch(n -> n.startsWith("sleeps skipped")));
    }

    @Test
    void rejected_upload_window_falls_back_to_backfill_endpoint() {
        cacheReturns(Map.of());
        when(apiClient.fetchPermissions("access"))
                .thenReturn(List.of("ACTIVITY_EXPORT", "HEALTH_EXPORT", "HISTORICAL_DATA_EXPORT"));
        when(apiClient.fetchSummaries("access", GarminDataset.DAILIES, plan.dailySince(), now,
                GarminApiClient.PullMode.UPLOAD)).thenThrow(new GarminUpstreamException("dailies", 400, "bad window"));
        when(apiClient.fetchSummaries("access", GarminDataset.DAILIES, plan.dailySince(), now,
                GarminApiClient.PullMode.BACKFILL)).thenReturn(List.of(daily("2026-03-09")));

        SyncExecution execution = executor.execute(plan);

        assertEquals(200, execution.status());
        assertEquals(1, execution.dailyMetricsUpserted());
        assertTrue(execution.notices().contains("dailies read from the backfill endpoint"));
    }

    @Test
    void token_rejected_after_forced_refresh_is_auth_failure() {
        when(apiClient.fetchGarminUserId("access")).thenThrow(new GarminUpstreamException("user id", 401, "expired"));

        SyncExecution execution = executor.execute(plan);

        assertEquals(401, execution.status());
        assertTrue(execution.needsReauth());
        verify(tokenStore).refresh(1L);
        verify(tokenStore).markAuthError(eq(1L), anyString());
        verify(tokenStore, never()).markSyncSuccess(anyLong(), any());
        verifyNoInteractions(exportStore);
    }

    @Test
    void upstream_outage_is_reported_as_retryable() {
        cacheReturns(Map.of());
        when(apiClient.fetchSummaries("access", GarminDataset.ACTIVITIES, plan.activitySince(), now,
                GarminApiClient.PullMode.UPLOAD)).thenThrow(new GarminUpstreamException("activities", 503, "down"));

        SyncExecution execution = executor.execute(plan);

        assertEquals(502, execution.status());
        assertEquals(SyncExecution.REASON_UPSTREAM_UNAVAILABLE, execution.reason());
        assertTrue(execution.isServerError());
        verify(tokenStore, never()).markSyncSuccess(anyLong(), any());
    }

    @Test
    void storage_failure_is_a_server_error() {
        GarminAnalyticsRepository failing = mock(GarminAnalyticsRepository.class);
        doThrow(new GarminStorageException("Failed to upsert garmin_daily_metrics", null))
                .when(failing).upsertDailyMetrics(anyList());
        executor = executorWith(failing);
        Map<GarminDataset, List<JsonNode>> cached = new EnumMap<>(GarminDataset.class);
        cached.put(GarminDataset.DAILIES, List.of(daily("2026-03-09")));
        cacheReturns(cached);

        SyncExecution execution = executor.execute(plan);

        assertEquals(500, execution.status());
        assertEquals(SyncExecution.REASON_STORAGE, execution.reason());
        verify(tokenStore, never()).markSyncSuccess(anyLong(), any());
        verifyNoInteractions(queuePublisher);
    }

    @Test
    void failed_success_write_is_reported_as_storage_error() {
        cacheReturns(Map.of());
        when(tokenStore.markSyncSuccess(eq(1L), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        SyncExecution execution = assertDoesNotThrow(() -> executor.execute(plan));

        assertEquals(500, execution.status());
        assertEquals(SyncExecution.REASON_STORAGE, execution.reason());
        assertFalse(execution.needsReauth());
        verifyNoInteractions(queuePublisher);
    }

    @Test
    void connection_removed_mid_sync_needs_reauth() {
        cacheReturns(Map.of());
        when(tokenStore.markSyncSuccess(eq(1L), any())).thenThrow(new GarminAuthException("Garmin is not connected"));

        SyncExecution execution = executor.execute(plan);

        assertEquals(401, execution.status());
        assertTrue(execution.needsReauth());
        verifyNoInteractions(queuePublisher);
    }

    @Test
    void cached_row_with_out_of_range_start_does_not_break_the_sync() throws Exception {
        Map<GarminDataset, List<JsonNode>> cached = new EnumMap<>(GarminDataset.class);
        cached.put(GarminDataset.ACTIVITIES, List.of(
                activity("a1", now.minus(Duration.ofDays(1))),
                objectMapper.readTree("{\"activityId\": \"bad\", \"startTimeInSeconds\": 1e20}")));
        cached.put(GarminDataset.DAILIES, List.of(
                daily("2026-03-09"),
                objectMapper.readTree("{\"startTimeInSeconds\": 1e20, \"steps\": 10}")));
        cacheReturns(cached);

        SyncExecution execution = executor.execute(plan);

        assertEquals(200, execution.status());
        assertEquals(1, execution.dailyMetricsUpserted());
        assertTrue(analyticsRepository.activities.values().stream().anyMatch(a -> a.activityId().equals("a1")));
    }
}

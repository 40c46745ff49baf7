package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.exception.GarminValidationException;
import com.runsmart.garmin_sync_engine.metrics.AcwrCalculator;
import com.runsmart.garmin_sync_engine.metrics.BaselineCalculator;
import com.runsmart.garmin_sync_engine.metrics.BodyBatteryExtractor;
import com.runsmart.garmin_sync_engine.metrics.ReadinessComputer;
import com.runsmart.garmin_sync_engine.metrics.ReadinessConfidenceCalculator;
import com.runsmart.garmin_sync_engine.metrics.UnderRecoveryEvaluator;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.DerivedMetric;
import com.runsmart.garmin_sync_engine.model.GarminActivity;
import com.runsmart.garmin_sync_engine.model.GarminConnection;
import com.runsmart.garmin_sync_engine.model.GarminDailyMetric;
import com.runsmart.garmin_sync_engine.model.InsightsJobPayload;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.repository.GarminActivityRepository;
import com.runsmart.garmin_sync_engine.repository.GarminDailyMetricRepository;
import com.runsmart.garmin_sync_engine.repository.InMemoryGarminAnalyticsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GarminDeriveWorkerTest {

    private final Instant now = Instant.parse("2026-03-10T08:00:00Z");
    private final LocalDate today = LocalDate.parse("2026-03-10");

    private final GarminTokenStore tokenStore = mock(GarminTokenStore.class);
    private final GarminActivityRepository activityRepository = mock(GarminActivityRepository.class);
    private final GarminDailyMetricRepository dailyMetricRepository = mock(GarminDailyMetricRepository.class);
    private final GarminQueuePublisher queuePublisher = mock(GarminQueuePublisher.class);
    private final InMemoryGarminAnalyticsRepository analyticsRepository = new InMemoryGarminAnalyticsRepository();

    private GarminDeriveWorker worker;

    @BeforeEach
    void setUp() {
        worker = new GarminDeriveWorker(tokenStore, activityRepository, dailyMetricRepository, analyticsRepository,
                new AcwrCalculator(170),
                new ReadinessComputer(new BaselineCalculator(), new ReadinessConfidenceCalculator(),
                        new UnderRecoveryEvaluator()),
                new BodyBatteryExtractor(), queuePublisher, Clock.fixed(now, ZoneOffset.UTC));
        when(queuePublisher.enqueueInsights(any())).thenReturn(new QueueResult(true, "insights", null));
    }

    private static GarminDailyMetric daily(Long userId, LocalDate date, double hrv, int restingHr) {
        GarminDailyMetric row = new GarminDailyMetric();
        row.setUserId(userId);
        row.setDate(date);
        row.setHrv(hrv);
        row.setRestingHr(restingHr);
        row.setSleepScore(82.0);
        row.setStress(25.0);
        row.setBodyBattery(75);
        return row;
    }

    private List<GarminDailyMetric> history(Long userId, int days) {
        List<GarminDailyMetric> rows = new ArrayList<>();
        for (int i = days - 1; i >= 0; i--) {
            rows.add(daily(userId, today.minusDays(i), 60.0, 48));
        }
        return rows;
    }

    @Test
    void one_failing_user_does_not_stop_the_others() {
        when(tokenStore.findUserIdsByGarminUserId("g-1")).thenReturn(List.of(1L, 2L));
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(1L), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(2L), any(), any()))
                .thenReturn(history(2L, 25));

        GarminDeriveWorker.DeriveJobResult result =
                worker.process(DeriveJobPayload.forGarminUser("g-1", "dailies", "webhook", now));

        assertEquals(1, result.processedUsers());
        assertEquals(1, result.skippedUsers());
        assertEquals(2L, result.summaries().get(0).userId());
        assertFalse(analyticsRepository.derivedMetrics.containsKey("1:" + today));
        assertTrue(analyticsRepository.derivedMetrics.containsKey("2:" + today));
    }

    @Test
    void unknown_garmin_user_is_a_no_op() {
        when(tokenStore.findUserIdsByGarminUserId("ghost")).thenReturn(List.of());

        GarminDeriveWorker.DeriveJobResult result =
                worker.process(DeriveJobPayload.forGarminUser("ghost", "dailies", "webhook", now));

        assertEquals(0, result.processedUsers());
        assertEquals(0, result.skippedUsers());
        verifyNoInteractions(dailyMetricRepository, activityRepository, queuePublisher);
    }

    @Test
    void payload_without_target_is_rejected() {
        DeriveJobPayload payload = new DeriveJobPayload(null, null, "dailies", "webhook", now.toString(), null);

        assertThrows(GarminValidationException.class, () -> worker.process(payload));
    }

    @Test
    void derived_row_carries_load_readiness_and_flags() {
        GarminConnection connection = new GarminConnection();
        connection.setLastSyncAt(now.minus(Duration.ofHours(1)));
        when(tokenStore.get(1L)).thenReturn(Optional.of(connection));
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(1L), any(), any()))
                .thenReturn(history(1L, 25));
        GarminActivity run = new GarminActivity();
        run.setStartTime(now.minus(Duration.ofDays(1)));
        run.setDurationS(3400);
        run.setAvgHr(170);
        run.setDistanceM(10_000.0);
        when(activityRepository.findWindow(eq(1L), any(), any())).thenReturn(List.of(run));

        GarminDeriveWorker.DeriveJobResult result =
                worker.process(DeriveJobPayload.forUser(1L, "post-sync", "sync", now, null));

        assertEquals(1, result.processedUsers());
        DerivedMetric row = analyticsRepository.derivedMetrics.get("1:" + today);
        assertNotNull(row);
        assertEquals(LocalDate.parse("2026-03-10"), row.date());
        assertEquals(485.71, row.acuteLoad7d());
        assertEquals(10_000.0, row.weeklyVolumeM());
        assertEquals("high", row.confidence());
        assertEquals(5, row.drivers().size());
        assertEquals(List.of(), row.flags().get("missingSignals"));
        assertFalse(row.flags().containsKey("source"));
        assertTrue(row.flags().containsKey("underRecovery"));
        assertTrue(row.flags().containsKey("acwrZone"));
        assertTrue(row.flags().containsKey("bodyBattery"));

        ArgumentCaptor<InsightsJobPayload> insights = ArgumentCaptor.forClass(InsightsJobPayload.class);
        verify(queuePublisher).enqueueInsights(insights.capture());
        assertEquals(InsightsJobPayload.DAILY, insights.getValue().insightType());
        assertEquals("2026-03-10", insights.getValue().date());
        assertEquals(row.readinessScore(), insights.getValue().derivedSummary().get("readinessScore"));
    }

    @Test
    void insights_failure_does_not_fail_the_user() {
        when(queuePublisher.enqueueInsights(any())).thenReturn(new QueueResult(false, "insights", "broker down"));

        GarminDeriveWorker.DeriveJobResult result =
                worker.process(DeriveJobPayload.forUser(1L, null, "manual", now, null));

        assertEquals(1, result.processedUsers());
        assertFalse(result.summaries().get(0).insightsQueued());
        assertTrue(analyticsRepository.derivedMetrics.containsKey("1:" + today));
    }

    @Test
    void backfill_recomputes_each_day_in_the_window() {
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(1L), any(), any()))
                .thenReturn(history(1L, 40));

        GarminDeriveWorker.DeriveJobResult result =
                worker.process(DeriveJobPayload.forUser(1L, "post-sync", "sync", now, 3));

        assertEquals(3, result.summaries().get(0).daysComputed());
        assertEquals(3, analyticsRepository.derivedMetrics.size());
        assertTrue(analyticsRepository.derivedMetrics.containsKey("1:2026-03-08"));
        verify(dailyMetricRepository).findByUserIdAndDateBetweenOrderByDateAsc(
                1L, LocalDate.parse("2026-02-08"), today);
        verify(queuePublisher, times(1)).enqueueInsights(any());
    }

    @Test
    void webhook_and_sync_jobs_over_the_same_data_write_the_same_row() {
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(1L), any(), any()))
                .thenReturn(history(1L, 20));

        worker.process(DeriveJobPayload.forUser(1L, "dailies", "webhook", now, null));
        DerivedMetric fromWebhook = analyticsRepository.derivedMetrics.get("1:" + today);
        worker.process(DeriveJobPayload.forUser(1L, "post-sync", "sync", now, null));

        assertEquals(fromWebhook, analyticsRepository.derivedMetrics.get("1:" + today));
    }

    @Test
    void rerunning_a_job_gives_the_same_row() {
        when(dailyMetricRepository.findByUserIdAndDateBetweenOrderByDateAsc(eq(1L), any(), any()))
                .thenReturn(history(1L, 20));
        DeriveJobPayload payload = DeriveJobPayload.forUser(1L, "post-sync", "sync", now, null);

        worker.process(payload);
        DerivedMetric first = analyticsRepository.derivedMetrics.get("1:" + today);
        worker.process(payload);

        assertEquals(first, analyticsRepository.derivedMetrics.get("1:" + today));
        assertEquals(1, analyticsRepository.derivedMetrics.size());
    }
}

package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.metrics.AcwrCalculator;
import com.runsmart.garmin_sync_engine.metrics.AcwrMetrics;
import com.runsmart.garmin_sync_engine.metrics.ActivityLoadSample;
import com.runsmart.garmin_sync_engine.metrics.BodyBatteryExtractor;
import com.runsmart.garmin_sync_engine.metrics.DailySignalSample;
import com.runsmart.garmin_sync_engine.metrics.ReadinessComputer;
import com.runsmart.garmin_sync_engine.metrics.ReadinessInput;
import com.runsmart.garmin_sync_engine.metrics.ReadinessResult;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.DeriveTarget;
import com.runsmart.garmin_sync_engine.model.DerivedMetric;
import com.runsmart.garmin_sync_engine.model.GarminActivity;
import com.runsmart.garmin_sync_engine.model.GarminConnection;
import com.runsmart.garmin_sync_engine.model.GarminDailyMetric;
import com.runsmart.garmin_sync_engine.model.InsightsJobPayload;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.repository.GarminActivityRepository;
import com.runsmart.garmin_sync_engine.repository.GarminAnalyticsRepository;
import com.runsmart.garmin_sync_engine.repository.GarminDailyMetricRepository;
import com.runsmart.garmin_sync_engine.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes {@code training_derived_metrics} rows for the users behind a derive job. Users are
 * processed one at a time and a failure for one user never stops the others.
 */
@Service
public class GarminDeriveWorker {
    private static final Logger logger = LoggerFactory.getLogger(GarminDeriveWorker.class);

    static final int MAX_BACKFILL_DAYS = 120;

    private final GarminTokenStore tokenStore;
    private final GarminActivityRepository activityRepository;
    private final GarminDailyMetricRepository dailyMetricRepository;
    private final GarminAnalyticsRepository analyticsRepository;
    private final AcwrCalculator acwrCalculator;
    private final ReadinessComputer readinessComputer;
    private final BodyBatteryExtractor bodyBatteryExtractor;
    private final GarminQueuePublisher queuePublisher;
    private final Clock clock;

    public GarminDeriveWorker(GarminTokenStore tokenStore,
                              GarminActivityRepository activityRepository,
                              GarminDailyMetricRepository dailyMetricRepository,
                              GarminAnalyticsRepository analyticsRepository,
                              AcwrCalculator acwrCalculator,
                              ReadinessComputer readinessComputer,
                              BodyBatteryExtractor bodyBatteryExtractor,
                              GarminQueuePublisher queuePublisher,
                              Clock clock) {
        this.tokenStore = tokenStore;
        this.activityRepository = activityRepository;
        this.dailyMetricRepository = dailyMetricRepository;
        this.analyticsRepository = analyticsRepository;
        this.acwrCalculator = acwrCalculator;
        this.readinessComputer = readinessComputer;
        this.bodyBatteryExtractor = bodyBatteryExtractor;
        this.queuePublisher = queuePublisher;
        this.clock = clock;
    }

    public record UserSummary(Long userId, int daysComputed, LocalDate latestDate, Integer readinessScore,
                              String readinessState, String confidence, boolean insightsQueued) {
    }

    public record DeriveJobResult(int processedUsers, int skippedUsers, List<UserSummary> summaries) {

        static DeriveJobResult empty() {
            return new DeriveJobResult(0, 0, List.of());
        }
    }

    /**
     * @throws com.runsmart.garmin_sync_engine.exception.GarminValidationException when the
     *         payload does not name exactly one target
     */
    public DeriveJobResult process(DeriveJobPayload payload) {
        DeriveTarget target = payload.target();
        List<Long> userIds = resolveUsers(target);
        if (userIds.isEmpty()) {
            logger.warn("Derive job {} matched no connected users", payload.jobId());
            return DeriveJobResult.empty();
        }

        int processed = 0;
        int skipped = 0;
        List<UserSummary> summaries = new ArrayList<>();
        for (Long userId : userIds) {
            try {
                summaries.add(deriveForUser(userId, payload));
                processed++;
            } catch (RuntimeException e) {
                skipped++;
                logger.error("Derive failed for user {} (job {}): {}", userId, payload.jobId(), e.getMessage(), e);
            }
        }

        logger.info("Derive job {} finished: {} processed, {} skipped", payload.jobId(), processed, skipped);
        return new DeriveJobResult(processed, skipped, List.copyOf(summaries));
    }

    private List<Long> resolveUsers(DeriveTarget target) {
        if (target instanceof DeriveTarget.ByUserId byUser) {
            return List.of(byUser.userId());
        }
        if (target instanceof DeriveTarget.ByGarminUserId byGarminUser) {
            return tokenStore.findUserIdsByGarminUserId(byGarminUser.garminUserId());
        }
        return List.of();
    }

    UserSummary deriveForUser(Long userId, DeriveJobPayload payload) {
        Instant now = clock.instant();
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        int days = payload.backfillDays() == null ? 1 : Math.max(1, Math.min(payload.backfillDays(), MAX_BACKFILL_DAYS));
        LocalDate firstDate = today.minusDays(days - 1L);
        // baselines and the chronic window both look back 28 days before the first target date
        LocalDate windowStart = firstDate.minusDays(AcwrCalculator.WINDOW_DAYS);

        List<GarminDailyMetric> dailyRows = dailyMetricRepository
                .findByUserIdAndDateBetweenOrderByDateAsc(userId, windowStart, today);
        List<ActivityLoadSample> loadSamples = activityRepository
                .findWindow(userId, windowStart.atStartOfDay(ZoneOffset.UTC).toInstant(),
                        today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant())
                .stream()
                .map(GarminDeriveWorker::toLoadSample)
                .toList();
        Instant lastSyncAt = lastSyncAt(userId);

        DerivedMetric latest = null;
        ReadinessResult latestReadiness = null;
        for (LocalDate date = firstDate; !date.isAfter(today); date = date.plusDays(1)) {
            LocalDate dayWindowStart = date.minusDays(AcwrCalculator.WINDOW_DAYS);
            LocalDate current = date;
            List<GarminDailyMetric> window = dailyRows.stream()
                    .filter(row -> !row.getDate().isBefore(dayWindowStart) && !row.getDate().isAfter(current))
                    .toList();

            AcwrMetrics acwr = acwrCalculator.compute(loadSamples, date);
            ReadinessResult readiness = readinessComputer.compute(new ReadinessInput(
                    window.stream().map(GarminDeriveWorker::toSignalSample).toList(),
                    lastSyncAt,
                    acwr.toTrainingLoad(),
                    now));

            latest = toDerivedMetric(userId, date, acwr, readiness, window);
            latestReadiness = readiness;
            analyticsRepository.upsertDerivedMetric(latest);
        }

        boolean insightsQueued = enqueueInsights(latest, latestReadiness, now);
        logger.info("Derived {} day(s) for user {} through {} from {}/{} (readiness {} {})",
                days, userId, today, payload.source(), payload.datasetKey(),
                latest.readinessScore(), latest.readinessState());
        return new UserSummary(userId, days, today, latest.readinessScore(), latest.readinessState(),
                latest.confidence(), insightsQueued);
    }

    private DerivedMetric toDerivedMetric(Long userId, LocalDate date, AcwrMetrics acwr, ReadinessResult readiness,
                                          List<GarminDailyMetric> window) {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("missingSignals", readiness.missingSignals());
        flags.put("underRecovery", readiness.underRecovery());
        flags.put("acwrZone", acwr.zone());
        flags.put("acwrFlags", acwr.flags());
        flags.put("evidenceConfidence", acwr.evidenceConfidence());
        flags.put("bodyBattery", bodyBatteryExtractor.summarize(bodyBatteryExtractor.extract(window)));

        return new DerivedMetric(
                userId,
                date,
                acwr.acuteLoad7d(),
                acwr.chronicLoad28d(),
                acwr.acwr(),
                acwr.monotony7d(),
                acwr.strain7d(),
                acwr.weeklyVolumeMeters7d(),
                readiness.score(),
                readiness.state(),
                readiness.drivers(),
                readiness.confidence(),
                readiness.confidenceReason(),
                flags);
    }

    private boolean enqueueInsights(DerivedMetric metric, ReadinessResult readiness, Instant now) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("readinessScore", metric.readinessScore());
        summary.put("readinessState", metric.readinessState());
        summary.put("confidence", metric.confidence());
        summary.put("acwr", metric.acwr());
        summary.put("acuteLoad7d", metric.acuteLoad7d());
        summary.put("chronicLoad28d", metric.chronicLoad28d());
        summary.put("underRecoveryFlagged", readiness.underRecovery().flagged());

        QueueResult queued = queuePublisher.enqueueInsights(new InsightsJobPayload(
                metric.userId(), InsightsJobPayload.DAILY, metric.date().toString(), now.toString(), summary));
        if (!queued.queued()) {
            logger.warn("Insights job for user {} not queued: {}", metric.userId(), queued.error());
        }
        return queued.queued();
    }

    private Instant lastSyncAt(Long userId) {
        Outcome<Instant> lastSync = Outcome.attempt(() ->
                tokenStore.get(userId).map(GarminConnection::getLastSyncAt).orElse(null));
        if (!lastSync.isSuccess()) {
            logger.warn("Could not read Garmin connection for user {}: {}", userId, lastSync.errorMessage());
        }
        return lastSync.value().orElse(null);
    }

    private static ActivityLoadSample toLoadSample(GarminActivity activity) {
        return new ActivityLoadSample(activity.getStartTime(), activity.getDurationS(), activity.getAvgHr(),
                activity.getDistanceM());
    }

    private static DailySignalSample toSignalSample(GarminDailyMetric row) {
        return new DailySignalSample(
                row.getDate(),
                row.getHrv(),
                row.getRestingHr() == null ? null : row.getRestingHr().doubleValue(),
                row.getSleepScore(),
                row.getStress(),
                row.getBodyBattery() == null ? null : row.getBodyBattery().doubleValue());
    }
}

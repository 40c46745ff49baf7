package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import com.runsmart.garmin_sync_engine.exception.GarminStorageException;
import com.runsmart.garmin_sync_engine.exception.GarminUpstreamException;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import com.runsmart.garmin_sync_engine.model.NormalizedActivity;
import com.runsmart.garmin_sync_engine.model.NormalizedDailyMetric;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.model.SyncExecution;
import com.runsmart.garmin_sync_engine.model.SyncPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One attempt at pulling a user's Garmin data into the analytics tables: export cache first,
 * device API when the cache has nothing, then normalize, upsert and queue a derive job.
 * Failures are reported as a {@link SyncExecution} status rather than thrown.
 */
@Service
public class GarminSyncExecutor {
    private static final Logger logger = LoggerFactory.getLogger(GarminSyncExecutor.class);

    static final String ACTIVITY_EXPORT = "ACTIVITY_EXPORT";
    static final String HEALTH_EXPORT = "HEALTH_EXPORT";
    static final String HISTORICAL_DATA_EXPORT = "HISTORICAL_DATA_EXPORT";
    static final String DERIVE_DATASET_KEY = "post-sync";
    static final String DERIVE_SOURCE = "sync";

    private final GarminTokenStore tokenStore;
    private final GarminApiClient apiClient;
    private final GarminExportStore exportStore;
    private final GarminNormalizer normalizer;
    private final GarminAnalyticsStore analyticsStore;
    private final GarminQueuePublisher queuePublisher;
    private final Clock clock;

    public GarminSyncExecutor(GarminTokenStore tokenStore,
                              GarminApiClient apiClient,
                              GarminExportStore exportStore,
                              GarminNormalizer normalizer,
                              GarminAnalyticsStore analyticsStore,
                              GarminQueuePublisher queuePublisher,
                              Clock clock) {
        this.tokenStore = tokenStore;
        this.apiClient = apiClient;
        this.exportStore = exportStore;
        this.normalizer = normalizer;
        this.analyticsStore = analyticsStore;
        this.queuePublisher = queuePublisher;
        this.clock = clock;
    }

    private record Access(String accessToken, String garminUserId, List<String> permissions) {
    }

    public SyncExecution execute(SyncPlan plan) {
        Long userId = plan.userId();
        List<String> notices = new ArrayList<>();

        Access access;
        try {
            access = resolveAccess(userId);
        } catch (GarminAuthException e) {
            tokenStore.markAuthError(userId, e.getMessage());
            return SyncExecution.authFailure(e.getMessage());
        } catch (GarminUpstreamException e) {
            return upstreamFailure(userId, e, notices);
        } catch (DataAccessException e) {
            logger.error("Failed to read Garmin connection for user {}: {}", userId, e.getMessage());
            return SyncExecution.failure(500, SyncExecution.REASON_STORAGE, e.getMessage(), notices);
        }

        Map<GarminDataset, List<JsonNode>> datasets = new EnumMap<>(GarminDataset.class);
        GarminExportStore.ReadResult cached = exportStore.readRows(access.garminUserId(), plan.dailySince());
        if (cached.ok()) {
            datasets.putAll(cached.rowsByDataset());
        } else {
            notices.add("Export cache unavailable: " + cached.storeError());
        }

        try {
            pullWhenEmpty(plan, access, datasets, GarminDataset.ACTIVITIES, plan.activitySince(), ACTIVITY_EXPORT, notices);
            pullWhenEmpty(plan, access, datasets, GarminDataset.DAILIES, plan.dailySince(), HEALTH_EXPORT, notices);
            pullWhenEmpty(plan, access, datasets, GarminDataset.SLEEPS, plan.dailySince(), HEALTH_EXPORT, notices);
        } catch (GarminUpstreamException e) {
            return upstreamFailure(userId, e, notices);
        }

        List<JsonNode> activityRows = new ArrayList<>();
        for (GarminDataset dataset : GarminDataset.values()) {
            if (dataset.isActivity()) {
                activityRows.addAll(datasets.getOrDefault(dataset, List.of()));
            }
        }
        List<NormalizedActivity> activities = normalizer.normalizeActivities(userId, activityRows).stream()
                .filter(a -> a.startTime() == null || !a.startTime().isBefore(plan.activitySince()))
                .toList();
        List<NormalizedDailyMetric> dailyMetrics = normalizer.normalizeDailyMetrics(userId, datasets);

        int activitiesUpserted;
        int dailyMetricsUpserted;
        try {
            activitiesUpserted = analyticsStore.upsertActivities(activities);
            dailyMetricsUpserted = analyticsStore.upsertDailyMetrics(dailyMetrics);
        } catch (GarminStorageException e) {
            logger.error("Storage failure while syncing Garmin data for user {}: {}", userId, e.getMessage());
            return SyncExecution.failure(500, SyncExecution.REASON_STORAGE, e.getMessage(), notices);
        }

        Instant syncedAt = clock.instant();
        try {
            tokenStore.markSyncSuccess(userId, syncedAt);
        } catch (GarminAuthException e) {
            logger.warn("Garmin connection for user {} went away during sync: {}", userId, e.getMessage());
            return SyncExecution.authFailure(e.getMessage());
        } catch (DataAccessException e) {
            logger.error("Failed to record Garmin sync success for user {}: {}", userId, e.getMessage());
            return SyncExecution.failure(500, SyncExecution.REASON_STORAGE, e.getMessage(), notices);
        }

        QueueResult derive = queuePublisher.enqueueDerive(DeriveJobPayload.forUser(
                userId, DERIVE_DATASET_KEY, DERIVE_SOURCE, syncedAt, plan.deriveDays()));
        if (!derive.queued()) {
            notices.add("Derived metrics will refresh on the next sync");
        }

        logger.info("Garmin sync for user {} ({}) upserted {} activities and {} daily rows",
                userId, plan.trigger().wireName(), activitiesUpserted, dailyMetricsUpserted);
        return SyncExecution.success(activitiesUpserted, dailyMetricsUpserted, derive.queued(), notices);
    }

    /**
     * Valid token plus profile and permissions. A token Garmin rejects gets one forced refresh.
     */
    private Access resolveAccess(Long userId) {
        String accessToken = tokenStore.getValidAccessToken(userId);
        try {
            return new Access(accessToken, apiClient.fetchGarminUserId(accessToken), apiClient.fetchPermissions(accessToken));
        } catch (GarminUpstreamException e) {
            if (!e.isAuthFailure()) {
                throw e;
            }
            logger.info("Garmin rejected the access token for user {}, refreshing once", userId);
        }
        tokenStore.refresh(userId);
        String refreshed = tokenStore.getValidAccessToken(userId);
        try {
            return new Access(refreshed, apiClient.fetchGarminUserId(refreshed), apiClient.fetchPermissions(refreshed));
        } catch (GarminUpstreamException e) {
            if (e.isAuthFailure()) {
                throw new GarminAuthException("Garmin rejected the refreshed access token", e);
            }
            throw e;
        }
    }

    private void pullWhenEmpty(SyncPlan plan, Access access, Map<GarminDataset, List<JsonNode>> datasets,
                               GarminDataset dataset, Instant since, String permission, List<String> notices) {
        if (!datasets.getOrDefault(dataset, List.of()).isEmpty()) {
            return;
        }
        if (!access.permissions().contains(permission)) {
            notices.add(dataset.key() + " skipped: " + permission + " permission not granted");
            return;
        }

        List<JsonNode> rows;
        try {
            rows = apiClient.fetchSummaries(access.accessToken(), dataset, since, plan.until(), GarminApiClient.PullMode.UPLOAD);
        } catch (GarminUpstreamException e) {
            if (e.isAuthFailure() || e.isServerError()) {
                throw e;
            }
            boolean fallbackWorthy = e.getStatus() == 400 || e.getStatus() == 404;
            if (!fallbackWorthy || !access.permissions().contains(HISTORICAL_DATA_EXPORT)) {
                notices.add(dataset.key() + " pull failed: " + e.getMessage());
                return;
            }
            rows = apiClient.fetchSummaries(access.accessToken(), dataset, since, plan.until(), GarminApiClient.PullMode.BACKFILL);
            notices.add(dataset.key() + " read from the backfill endpoint");
        }

        if (rows.isEmpty()) {
            return;
        }
        datasets.put(dataset, rows);
        GarminExportStore.StoreResult stored = exportStore.storeRows(
                dataset, rows, GarminExportRecord.ExportSource.API_PULL, access.garminUserId());
        if (!stored.ok()) {
            notices.add(dataset.key() + " rows were not cached: " + stored.storeError());
        }
    }

    private SyncExecution upstreamFailure(Long userId, GarminUpstreamException e, List<String> notices) {
        if (e.isAuthFailure()) {
            tokenStore.markAuthError(userId, e.getMessage());
            return SyncExecution.authFailure(e.getMessage());
        }
        if (e.isServerError()) {
            logger.warn("Garmin {} unavailable for user {}: {}", e.getSource(), userId, e.getMessage());
            return SyncExecution.failure(502, SyncExecution.REASON_UPSTREAM_UNAVAILABLE, e.getMessage(), notices);
        }
        logger.warn("Garmin {} rejected the request for user {}: {}", e.getSource(), userId, e.getMessage());
        return SyncExecution.failure(e.getStatus(), SyncExecution.REASON_UPSTREAM_ERROR, e.getMessage(), notices);
    }
}

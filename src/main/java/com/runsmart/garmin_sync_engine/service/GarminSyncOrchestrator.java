package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.model.GarminConnection;
import com.runsmart.garmin_sync_engine.model.SyncExecution;
import com.runsmart.garmin_sync_engine.model.SyncPlan;
import com.runsmart.garmin_sync_engine.model.SyncRequest;
import com.runsmart.garmin_sync_engine.model.SyncResult;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.util.Retry;
import com.runsmart.garmin_sync_engine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Entry point for syncing one user: connection check, cooldown, lookback planning and bounded
 * retries of the execution on 5xx.
 */
@Service
public class GarminSyncOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(GarminSyncOrchestrator.class);

    private final GarminTokenStore tokenStore;
    private final GarminSyncRateLimiter rateLimiter;
    private final GarminSyncExecutor executor;
    private final GarminProperties.Sync settings;
    private final Sleeper sleeper;
    private final Clock clock;

    public GarminSyncOrchestrator(GarminTokenStore tokenStore,
                                  GarminSyncRateLimiter rateLimiter,
                                  GarminSyncExecutor executor,
                                  GarminProperties properties,
                                  Sleeper sleeper,
                                  Clock clock) {
        this.tokenStore = tokenStore;
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.settings = properties.getSync();
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public SyncResult syncUser(SyncRequest request) {
        Long userId = request.userId();
        SyncTrigger trigger = request.trigger() == null ? SyncTrigger.MANUAL : request.trigger();
        Instant now = clock.instant();

        Optional<GarminConnection> connection = tokenStore.get(userId);
        if (connection.isEmpty() || connection.get().getStatus() == GarminConnection.ConnectionStatus.DISCONNECTED) {
            logger.info("Skipping Garmin sync for user {}: not connected", userId);
            return SyncResult.notConnected();
        }

        Instant lastSyncAt = connection.get().getLastSyncAt();
        GarminSyncRateLimiter.Decision decision = rateLimiter.evaluate(userId, lastSyncAt, trigger, now);
        if (!decision.allowed()) {
            logger.info("Garmin sync for user {} rate limited ({}), retry in {}s",
                    userId, decision.reason(), decision.retryAfterSeconds());
            return SyncResult.rateLimited(lastSyncAt, decision.reason(), decision.retryAfterSeconds());
        }

        SyncPlan plan = plan(userId, trigger, request.sinceIso(), connection.get().getLastSyncCursor(), now);
        logger.info("Starting Garmin {} sync for user {} (daily since {}, activities since {})",
                trigger.wireName(), userId, plan.dailySince(), plan.activitySince());

        Retry.Attempted<SyncExecution> attempted = Retry.withRetry(
                attempt -> executor.execute(plan),
                SyncExecution::isServerError,
                settings.getMaxAttempts(),
                settings.getBaseBackoff(),
                sleeper);
        SyncExecution execution = attempted.value();

        if (!execution.isSuccess() && !execution.needsReauth()) {
            tokenStore.markSyncError(userId, execution.reason(), execution.error());
        }

        GarminConnection after = tokenStore.get(userId).orElse(null);
        boolean connected = after != null && after.isConnected();
        boolean noOp = execution.isSuccess()
                && execution.activitiesUpserted() == 0 && execution.dailyMetricsUpserted() == 0;

        logger.info("Garmin sync for user {} finished with status {} after {} attempt(s)",
                userId, execution.status(), attempted.attempts());
        return new SyncResult(
                execution.status(),
                connected,
                execution.needsReauth(),
                after == null ? null : after.getLastSyncAt(),
                execution.activitiesUpserted(),
                execution.dailyMetricsUpserted(),
                noOp,
                null,
                execution.reason(),
                execution.error(),
                attempted.attempts(),
                execution.deriveQueued(),
                execution.notices());
    }

    /**
     * Incremental syncs reach back a fixed window before the cursor, backfills a longer one.
     * Activities are bounded separately, whatever the trigger.
     */
    SyncPlan plan(Long userId, SyncTrigger trigger, String sinceIso, Instant cursor, Instant now) {
        Instant longest = now.minus(Duration.ofDays(settings.getBackfillLookbackDays()));
        Instant dailySince;
        Instant requested = parse(sinceIso);
        if (requested != null) {
            dailySince = requested;
        } else if (trigger == SyncTrigger.BACKFILL) {
            dailySince = longest;
        } else {
            Instant anchor = cursor != null && cursor.isBefore(now) ? cursor : now;
            dailySince = anchor.minus(Duration.ofDays(settings.getIncrementalLookbackDays()));
        }
        if (dailySince.isBefore(longest)) {
            dailySince = longest;
        }

        Instant activityFloor = now.minus(Duration.ofDays(settings.getActivityLookbackDays()));
        Instant activitySince = dailySince.isBefore(activityFloor) ? activityFloor : dailySince;

        Integer deriveDays = trigger == SyncTrigger.BACKFILL
                ? (int) Math.max(1, Duration.between(dailySince, now).toDays() + 1)
                : null;
        return new SyncPlan(userId, trigger, dailySince, activitySince, now, deriveDays);
    }

    private static Instant parse(String sinceIso) {
        if (sinceIso == null || sinceIso.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(sinceIso.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring unparseable sync lower bound {}", sinceIso);
            return null;
        }
    }
}

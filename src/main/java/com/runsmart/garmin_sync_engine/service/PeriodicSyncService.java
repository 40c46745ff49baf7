package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.model.SyncJobPayload;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
public class PeriodicSyncService {
    private static final Logger logger = LoggerFactory.getLogger(PeriodicSyncService.class);

    private final GarminTokenStore tokenStore;
    private final GarminQueuePublisher queuePublisher;
    private final Clock clock;

    /**
     * Nightly sync for every connected user, 03:00 UTC by default.
     *
     * @return number of jobs queued
     */
    @Scheduled(cron = "${app.garmin.sync.nightly-cron:0 0 3 * * *}", zone = "UTC")
    public int triggerNightlySync() {
        logger.info("Starting scheduled nightly Garmin sync for all connected users...");

        List<Long> userIds = tokenStore.listConnectedUserIds();
        logger.info("Found {} connected users to sync", userIds.size());

        String requestedAt = clock.instant().toString();
        int queued = 0;
        for (Long userId : userIds) {
            QueueResult result = queuePublisher.enqueueSync(
                    new SyncJobPayload(userId, SyncTrigger.NIGHTLY.wireName(), null, requestedAt));
            if (result.queued()) {
                queued++;
            } else {
                logger.error("Failed to trigger nightly sync for user {}: {}", userId, result.error());
            }
        }
        return queued;
    }
}

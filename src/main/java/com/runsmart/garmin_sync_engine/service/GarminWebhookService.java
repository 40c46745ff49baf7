package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.runsmart.garmin_sync_engine.exception.GarminUpstreamException;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores webhook deliveries in the export store. Push entries are stored as they arrive; ping
 * entries carry a {@code callbackURL} whose rows are pulled first. Afterwards one derive job is
 * queued per Garmin user and dataset that received rows.
 */
@Service
public class GarminWebhookService {
    private static final Logger logger = LoggerFactory.getLogger(GarminWebhookService.class);

    private final GarminExportStore exportStore;
    private final GarminApiClient apiClient;
    private final GarminQueuePublisher queuePublisher;
    private final Clock clock;

    public GarminWebhookService(GarminExportStore exportStore, GarminApiClient apiClient,
                                GarminQueuePublisher queuePublisher, Clock clock) {
        this.exportStore = exportStore;
        this.apiClient = apiClient;
        this.queuePublisher = queuePublisher;
        this.clock = clock;
    }

    public record DeriveQueueSummary(boolean queued, int jobs) {
    }

    public record WebhookIngestResult(boolean ok, int acceptedRows, int droppedRows, List<String> callbackErrors,
                                      List<String> storeErrors, DeriveQueueSummary deriveQueue) {
    }

    public WebhookIngestResult ingest(JsonNode body) {
        int accepted = 0;
        int dropped = 0;
        List<String> callbackErrors = new ArrayList<>();
        List<String> storeErrors = new ArrayList<>();
        Map<String, Set<GarminDataset>> touched = new LinkedHashMap<>();

        for (GarminDataset dataset : GarminDataset.values()) {
            for (JsonNode entry : JsonFields.rows(body.get(dataset.key()))) {
                String callbackUrl = JsonFields.firstText(entry, "callbackURL", "callbackUrl");
                GarminExportStore.StoreResult stored;
                if (callbackUrl != null) {
                    List<JsonNode> pulled;
                    try {
                        pulled = apiClient.fetchCallbackRows(callbackUrl);
                    } catch (GarminUpstreamException e) {
                        logger.warn("Garmin {} callback failed: {}", dataset.key(), e.getMessage());
                        callbackErrors.add(dataset.key() + ": " + e.getMessage());
                        continue;
                    }
                    stored = exportStore.storeRows(dataset, pulled, GarminExportRecord.ExportSource.PING_PULL,
                            JsonFields.firstText(entry, "userId", "userID"));
                } else {
                    stored = exportStore.storeRows(dataset, List.of(entry), GarminExportRecord.ExportSource.PUSH, null);
                }

                accepted += stored.storedRows();
                dropped += stored.droppedRows();
                if (!stored.ok()) {
                    storeErrors.add(dataset.key() + ": " + stored.storeError());
                }
                for (String garminUserId : stored.garminUserIds()) {
                    touched.computeIfAbsent(garminUserId, key -> new LinkedHashSet<>()).add(dataset);
                }
            }
        }

        DeriveQueueSummary deriveQueue = enqueueDerive(touched);
        logger.info("Garmin webhook stored {} rows ({} dropped, {} derive jobs)", accepted, dropped, deriveQueue.jobs());
        return new WebhookIngestResult(storeErrors.isEmpty(), accepted, dropped, List.copyOf(callbackErrors),
                List.copyOf(storeErrors), deriveQueue);
    }

    private DeriveQueueSummary enqueueDerive(Map<String, Set<GarminDataset>> touched) {
        Instant now = clock.instant();
        int jobs = 0;
        boolean allQueued = true;
        for (Map.Entry<String, Set<GarminDataset>> entry : touched.entrySet()) {
            for (GarminDataset dataset : entry.getValue()) {
                QueueResult result = queuePublisher.enqueueDerive(
                        DeriveJobPayload.forGarminUser(entry.getKey(), dataset.key(), "webhook", now));
                jobs++;
                allQueued &= result.queued();
            }
        }
        return new DeriveQueueSummary(jobs > 0 && allQueued, jobs);
    }
}

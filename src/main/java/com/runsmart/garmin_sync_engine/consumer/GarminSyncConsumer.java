package com.runsmart.garmin_sync_engine.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.model.SyncJobPayload;
import com.runsmart.garmin_sync_engine.model.SyncRequest;
import com.runsmart.garmin_sync_engine.model.SyncResult;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.service.GarminSyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
public class GarminSyncConsumer {
    private static final Logger logger = LoggerFactory.getLogger(GarminSyncConsumer.class);

    private final GarminSyncOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public GarminSyncConsumer(GarminSyncOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(topics = "${app.garmin.topics.sync}", groupId = "${spring.kafka.consumer.group-id}")
    public void consume(String message) {
        SyncJobPayload payload;
        try {
            payload = objectMapper.readValue(message, SyncJobPayload.class);
        } catch (JsonProcessingException e) {
            logger.error("Dropping unreadable sync job: {}", e.getOriginalMessage());
            return;
        }
        if (payload.userId() == null) {
            logger.error("Dropping sync job without a user id: {}", message);
            return;
        }

        logger.info("Received sync job {}", payload.jobId());
        SyncResult result = orchestrator.syncUser(
                new SyncRequest(payload.userId(), SyncTrigger.fromWire(payload.trigger()), payload.sinceIso()));
        if (result.status() >= 400) {
            logger.warn("Sync job {} ended with {} ({})", payload.jobId(), result.status(), result.reason());
        }
    }
}

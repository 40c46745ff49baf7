package com.runsmart.garmin_sync_engine.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.exception.GarminValidationException;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.service.GarminDeriveWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
public class GarminDeriveConsumer {
    private static final Logger logger = LoggerFactory.getLogger(GarminDeriveConsumer.class);

    private final GarminDeriveWorker deriveWorker;
    private final ObjectMapper objectMapper;

    public GarminDeriveConsumer(GarminDeriveWorker deriveWorker, ObjectMapper objectMapper) {
        this.deriveWorker = deriveWorker;
        this.objectMapper = objectMapper;
    }

    /**
     * Malformed jobs are logged and dropped. Anything else thrown here goes back to the listener
     * container so the message is redelivered.
     */
    @KafkaListener(topics = "${app.garmin.topics.derive}",
            groupId = "${spring.kafka.consumer.group-id}",
            concurrency = "${spring.kafka.listener.concurrency:2}")
    public void consume(String message) {
        DeriveJobPayload payload;
        try {
            payload = objectMapper.readValue(message, DeriveJobPayload.class);
        } catch (JsonProcessingException e) {
            logger.error("Dropping unreadable derive job: {}", e.getOriginalMessage());
            return;
        }

        logger.info("Received derive job {} (source {})", payload.jobId(), payload.source());
        try {
            GarminDeriveWorker.DeriveJobResult result = deriveWorker.process(payload);
            logger.info("Derive job {} done: {} processed, {} skipped",
                    payload.jobId(), result.processedUsers(), result.skippedUsers());
        } catch (GarminValidationException e) {
            logger.error("Dropping invalid derive job {}: {}", payload.jobId(), e.getMessage());
        }
    }
}

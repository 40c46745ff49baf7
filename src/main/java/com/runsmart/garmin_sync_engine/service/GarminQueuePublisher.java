package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.model.DeriveJobPayload;
import com.runsmart.garmin_sync_engine.model.InsightsJobPayload;
import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.model.SyncJobPayload;
import com.runsmart.garmin_sync_engine.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Kafka producer for sync, derive and insights jobs. The job id is the message key. Publishing
 * never throws; failures come back in the {@link QueueResult}.
 */
@Service
public class GarminQueuePublisher {
    private static final Logger logger = LoggerFactory.getLogger(GarminQueuePublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final GarminProperties properties;

    public GarminQueuePublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                GarminProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public QueueResult enqueueSync(SyncJobPayload payload) {
        return publish(properties.getTopics().getSync(), payload.jobId(), payload);
    }

    public QueueResult enqueueDerive(DeriveJobPayload payload) {
        return publish(properties.getTopics().getDerive(), payload.jobId(), payload);
    }

    public QueueResult enqueueInsights(InsightsJobPayload payload) {
        return publish(properties.getTopics().getInsights(), payload.jobId(), payload);
    }

    private QueueResult publish(String topic, String jobId, Object payload) {
        Outcome<Void> outcome = Outcome.run(() -> kafkaTemplate.send(topic, jobId, toJson(payload))
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        logger.warn("Delivery of job {} to {} failed: {}", jobId, topic, ex.getMessage());
                    }
                }));
        if (!outcome.isSuccess()) {
            logger.warn("Failed to enqueue job {} on {}: {}", jobId, topic, outcome.errorMessage());
            return new QueueResult(false, jobId, outcome.errorMessage());
        }
        logger.debug("Enqueued job {} on {}", jobId, topic);
        return new QueueResult(true, jobId, null);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize job payload", e);
        }
    }
}

package com.runsmart.garmin_sync_engine.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.service.GarminWebhookService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Map;

@RestController
@RequestMapping("/api/devices/garmin/webhook")
public class GarminWebhookController {
    private static final Logger logger = LoggerFactory.getLogger(GarminWebhookController.class);

    static final String SECRET_HEADER = "x-garmin-webhook-secret";

    private final GarminWebhookService webhookService;
    private final GarminProperties properties;
    private final ObjectMapper objectMapper;

    public GarminWebhookController(GarminWebhookService webhookService, GarminProperties properties,
                                   ObjectMapper objectMapper) {
        this.webhookService = webhookService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> reachability(
            @RequestHeader(value = SECRET_HEADER, required = false) String headerSecret,
            @RequestParam(value = "secret", required = false) String querySecret) {
        ResponseEntity<Map<String, Object>> rejected = authorize(headerSecret, querySecret);
        if (rejected != null) {
            return rejected;
        }
        return ResponseEntity.ok(Map.of(
                "ok", true,
                "message", "Garmin webhook endpoint is reachable",
                "datasets", Arrays.stream(GarminDataset.values()).map(GarminDataset::key).toList()));
    }

    @PostMapping
    public ResponseEntity<?> receive(
            @RequestHeader(value = SECRET_HEADER, required = false) String headerSecret,
            @RequestParam(value = "secret", required = false) String querySecret,
            @RequestBody(required = false) String body) {
        ResponseEntity<Map<String, Object>> rejected = authorize(headerSecret, querySecret);
        if (rejected != null) {
            return rejected;
        }

        JsonNode payload;
        try {
            payload = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            payload = null;
        }
        if (payload == null || !payload.isObject()) {
            logger.warn("Rejected Garmin webhook with an unreadable body");
            return ResponseEntity.badRequest().body(Map.of("ok", false, "error", "Invalid JSON payload"));
        }

        return ResponseEntity.ok(webhookService.ingest(payload));
    }

    private ResponseEntity<Map<String, Object>> authorize(String headerSecret, String querySecret) {
        String expected = properties.getWebhookSecret();
        if (expected == null || expected.isBlank()) {
            logger.error("Garmin webhook called but no webhook secret is configured");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("ok", false, "error", "Garmin webhook is not configured"));
        }
        String provided = headerSecret != null && !headerSecret.isBlank() ? headerSecret : querySecret;
        if (provided == null || !MessageDigest.isEqual(
                expected.trim().getBytes(StandardCharsets.UTF_8), provided.trim().getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Rejected Garmin webhook with a missing or wrong secret");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("ok", false, "error", "Unauthorized"));
        }
        return null;
    }
}

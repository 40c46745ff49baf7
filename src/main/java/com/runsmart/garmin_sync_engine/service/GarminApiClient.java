package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.exception.GarminUpstreamException;
import com.runsmart.garmin_sync_engine.model.GarminDataset;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bearer-token client for the Garmin Health (wellness) REST API.
 */
@Component
public class GarminApiClient {
    private static final Logger logger = LoggerFactory.getLogger(GarminApiClient.class);

    private static final String WELLNESS_PATH = "/wellness-api/rest";

    private final HttpClient httpClient;
    private final GarminProperties properties;
    private final ObjectMapper objectMapper;

    public GarminApiClient(HttpClient httpClient, GarminProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public enum PullMode {
        /** Summaries uploaded in the window; filtered on upload time. */
        UPLOAD,
        /** Historical summaries; filtered on summary time. Needs HISTORICAL_DATA_EXPORT. */
        BACKFILL
    }

    public record TimeWindow(long startSeconds, long endSeconds) {
    }

    public String fetchGarminUserId(String accessToken) {
        JsonNode json = getJson("profile", URI.create(properties.getApiBaseUrl() + WELLNESS_PATH + "/user/id"), accessToken);
        String userId = JsonFields.firstText(json, "userId", "id");
        if (userId == null) {
            throw new GarminUpstreamException("profile", 502, "Garmin profile response did not include userId");
        }
        return userId;
    }

    public List<String> fetchPermissions(String accessToken) {
        JsonNode json = getJson("permissions",
                URI.create(properties.getApiBaseUrl() + WELLNESS_PATH + "/user/permissions"), accessToken);
        JsonNode list = json != null && json.isArray() ? json : JsonFields.at(json, "permissions");
        List<String> permissions = new ArrayList<>();
        if (list != null && list.isArray()) {
            list.forEach(entry -> {
                if (entry.isTextual()) {
                    permissions.add(entry.asText());
                }
            });
        }
        return permissions;
    }

    /**
     * Pulls one dataset for {@code [start, end]}, split into windows no longer than the
     * provider's maximum.
     */
    public List<JsonNode> fetchSummaries(String accessToken, GarminDataset dataset, Instant start, Instant end, PullMode mode) {
        List<JsonNode> rows = new ArrayList<>();
        String path = WELLNESS_PATH + (mode == PullMode.BACKFILL ? "/backfill/" : "/") + dataset.key();
        String startParam = mode == PullMode.BACKFILL ? "summaryStartTimeInSeconds" : "uploadStartTimeInSeconds";
        String endParam = mode == PullMode.BACKFILL ? "summaryEndTimeInSeconds" : "uploadEndTimeInSeconds";

        for (TimeWindow window : windows(start.getEpochSecond(), end.getEpochSecond(), properties.getMaxWindowSeconds())) {
            URI uri = URI.create(properties.getApiBaseUrl() + path
                    + "?" + startParam + "=" + window.startSeconds()
                    + "&" + endParam + "=" + window.endSeconds());
            rows.addAll(JsonFields.rows(getJson(dataset.key(), uri, accessToken)));
        }
        logger.debug("Pulled {} {} rows ({}) from Garmin", rows.size(), dataset.key(), mode);
        return rows;
    }

    /**
     * Fetches the payload behind a ping/pull notification. The callback URL carries its own
     * pull token, so no bearer header is sent.
     */
    public List<JsonNode> fetchCallbackRows(String callbackUrl) {
        URI uri;
        try {
            uri = URI.create(callbackUrl);
        } catch (IllegalArgumentException e) {
            throw new GarminUpstreamException("callbackURL", "invalid URL", e);
        }
        return JsonFields.rows(getJson("callbackURL", uri, null));
    }

    /**
     * Inclusive windows of at most {@code maxWindowSeconds} covering {@code [start, end]}.
     */
    static List<TimeWindow> windows(long start, long end, long maxWindowSeconds) {
        List<TimeWindow> windows = new ArrayList<>();
        for (long windowStart = start; windowStart <= end; windowStart += maxWindowSeconds) {
            windows.add(new TimeWindow(windowStart, Math.min(windowStart + maxWindowSeconds - 1, end)));
        }
        return windows;
    }

    private JsonNode getJson(String source, URI uri, String accessToken) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getHttpTimeout())
                .header("Accept", "application/json")
                .GET();
        if (accessToken != null) {
            builder.header("Authorization", "Bearer " + accessToken);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GarminUpstreamException(source, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GarminUpstreamException(source, "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            logger.warn("Garmin {} returned status {}", source, response.statusCode());
            throw new GarminUpstreamException(source, response.statusCode(), response.body());
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GarminUpstreamException(source, 502, "Garmin returned a non-JSON body");
        }
    }
}

package com.runsmart.garmin_sync_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import com.runsmart.garmin_sync_engine.exception.GarminUpstreamException;
import com.runsmart.garmin_sync_engine.util.JsonFields;
import com.runsmart.garmin_sync_engine.util.Retry;
import com.runsmart.garmin_sync_engine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Refresh-token exchange against Garmin's OAuth2 token endpoint.
 */
@Component
public class GarminOAuthClient {
    private static final Logger logger = LoggerFactory.getLogger(GarminOAuthClient.class);

    static final long DEFAULT_EXPIRES_IN_SECONDS = 7_776_000;
    private static final int MAX_ATTEMPTS = 3;
    private static final Duration BASE_BACKOFF = Duration.ofMillis(500);

    private final HttpClient httpClient;
    private final GarminProperties properties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public GarminOAuthClient(HttpClient httpClient, GarminProperties properties, ObjectMapper objectMapper, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
    }

    public record TokenResponse(String accessToken, String refreshToken, long expiresInSeconds, String scope) {
    }

    private record RawResponse(int status, String body) {
        boolean retryable() {
            return status == 0 || status == 429 || status >= 500;
        }
    }

    /**
     * @throws GarminAuthException     when Garmin rejects the refresh token
     * @throws GarminUpstreamException when the endpoint stays unavailable after retries
     */
    public TokenResponse refresh(String refreshToken) {
        if (properties.getClientId() == null || properties.getClientSecret() == null) {
            throw new GarminAuthException("Garmin OAuth client credentials are not configured");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", properties.getClientId());
        form.put("client_secret", properties.getClientSecret());
        String body = form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        Retry.Attempted<RawResponse> attempted = Retry.withRetry(
                attempt -> post(body, attempt), RawResponse::retryable, MAX_ATTEMPTS, BASE_BACKOFF, sleeper);
        RawResponse response = attempted.value();

        if (response.status() >= 200 && response.status() < 300) {
            return parse(response.body(), refreshToken);
        }
        if (response.retryable()) {
            throw new GarminUpstreamException("Garmin token endpoint", response.status(), response.body());
        }
        throw new GarminAuthException("Garmin rejected the refresh token (status " + response.status() + ")");
    }

    private RawResponse post(String form, int attempt) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getTokenUrl()))
                .timeout(properties.getHttpTimeout())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                logger.warn("Garmin token refresh attempt {} returned {}", attempt, response.statusCode());
            }
            return new RawResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            logger.warn("Garmin token refresh attempt {} failed: {}", attempt, e.getMessage());
            return new RawResponse(0, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GarminUpstreamException("Garmin token endpoint", "interrupted", e);
        }
    }

    private TokenResponse parse(String body, String previousRefreshToken) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GarminAuthException("Garmin token response was not JSON", e);
        }
        String accessToken = JsonFields.firstText(json, "access_token");
        if (accessToken == null) {
            throw new GarminAuthException("Garmin token response did not include an access token");
        }
        String refreshToken = JsonFields.firstText(json, "refresh_token");
        Double expiresIn = JsonFields.firstDouble(json, "expires_in");
        return new TokenResponse(
                accessToken,
                refreshToken != null ? refreshToken : previousRefreshToken,
                expiresIn != null && expiresIn > 0 ? expiresIn.longValue() : DEFAULT_EXPIRES_IN_SECONDS,
                JsonFields.firstText(json, "scope"));
    }
}

package com.runsmart.garmin_sync_engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.garmin")
public class GarminProperties {

    private String apiBaseUrl = "https://apis.garmin.com";
    private String tokenUrl = "https://diauth.garmin.com/di-oauth2-service/oauth/token";
    private String clientId;
    private String clientSecret;

    /** Shared secret expected on webhook calls. Blank means the webhook is not configured. */
    private String webhookSecret;

    /** Connect and request timeout for every outbound call. */
    private Duration httpTimeout = Duration.ofSeconds(20);

    /** Largest query window the device API accepts. */
    private long maxWindowSeconds = 86_400;

    private int thresholdHeartRate = 170;

    private Sync sync = new Sync();
    private Topics topics = new Topics();

    @Data
    public static class Sync {
        private Duration manualCooldown = Duration.ofMinutes(10);
        private Duration backfillCooldown = Duration.ofMinutes(60);
        private int incrementalLookbackDays = 30;
        private int backfillLookbackDays = 90;
        private int activityLookbackDays = 90;
        private int maxAttempts = 3;
        private Duration baseBackoff = Duration.ofMillis(500);
        private String nightlyCron = "0 0 3 * * *";
    }

    @Data
    public static class Topics {
        private String sync = "garmin.sync.requested";
        private String derive = "garmin.derive.requested";
        private String insights = "ai.insights.requested";
    }
}

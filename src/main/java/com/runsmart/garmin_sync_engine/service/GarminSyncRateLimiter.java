package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.config.GarminProperties;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown policy between syncs. Holds no state: the only input that changes between calls is
 * the connection's {@code lastSyncAt}, which the caller reads fresh.
 */
@Component
public class GarminSyncRateLimiter {

    public static final String REASON_COOLDOWN = "cooldown";
    public static final String REASON_BACKFILL_COOLDOWN = "backfill_cooldown";

    private final Duration manualCooldown;
    private final Duration backfillCooldown;

    @Autowired
    public GarminSyncRateLimiter(GarminProperties properties) {
        this(properties.getSync().getManualCooldown(), properties.getSync().getBackfillCooldown());
    }

    GarminSyncRateLimiter(Duration manualCooldown, Duration backfillCooldown) {
        this.manualCooldown = manualCooldown;
        this.backfillCooldown = backfillCooldown;
    }

    public record Decision(boolean allowed, String reason, Long retryAfterSeconds) {

        static Decision allow() {
            return new Decision(true, null, null);
        }
    }

    public Decision evaluate(Long userId, Instant lastSyncAt, SyncTrigger trigger, Instant now) {
        if (lastSyncAt == null) {
            return Decision.allow();
        }
        boolean backfill = trigger == SyncTrigger.BACKFILL;
        Duration cooldown = backfill ? backfillCooldown : manualCooldown;
        Instant nextAllowed = lastSyncAt.plus(cooldown);
        if (!now.isBefore(nextAllowed)) {
            return Decision.allow();
        }
        // whole seconds, rounded up
        long retryAfter = Math.max(1, (Duration.between(now, nextAllowed).toMillis() + 999) / 1000);
        return new Decision(false, backfill ? REASON_BACKFILL_COOLDOWN : REASON_COOLDOWN, retryAfter);
    }

    public Duration cooldownFor(SyncTrigger trigger) {
        return trigger == SyncTrigger.BACKFILL ? backfillCooldown : manualCooldown;
    }
}

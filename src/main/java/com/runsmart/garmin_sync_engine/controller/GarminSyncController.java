package com.runsmart.garmin_sync_engine.controller;

import com.runsmart.garmin_sync_engine.model.SyncRequest;
import com.runsmart.garmin_sync_engine.model.SyncResult;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.service.GarminSyncOrchestrator;
import com.runsmart.garmin_sync_engine.service.GarminTokenStore;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/devices/garmin")
public class GarminSyncController {
    static final String USER_HEADER = "X-User-Id";

    private final GarminSyncOrchestrator orchestrator;
    private final GarminTokenStore tokenStore;

    public GarminSyncController(GarminSyncOrchestrator orchestrator, GarminTokenStore tokenStore) {
        this.orchestrator = orchestrator;
        this.tokenStore = tokenStore;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "UP", "service", "garmin-sync-engine");
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResult> sync(@RequestHeader(USER_HEADER) Long userId,
                                           @RequestParam(value = "trigger", required = false) String trigger,
                                           @RequestParam(value = "since", required = false) String since) {
        SyncResult result = orchestrator.syncUser(new SyncRequest(userId, SyncTrigger.fromWire(trigger), since));
        ResponseEntity.BodyBuilder response = ResponseEntity.status(result.status());
        if (result.retryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
        }
        return response.body(result);
    }

    @DeleteMapping("/connection")
    public ResponseEntity<Void> disconnect(@RequestHeader(USER_HEADER) Long userId) {
        tokenStore.disconnect(userId);
        return ResponseEntity.noContent().build();
    }
}

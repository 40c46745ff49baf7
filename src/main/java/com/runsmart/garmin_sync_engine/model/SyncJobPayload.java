package com.runsmart.garmin_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncJobPayload(Long userId, String trigger, String sinceIso, String requestedAt) {

    public String jobId() {
        String day = requestedAt != null && requestedAt.length() >= 10 ? requestedAt.substring(0, 10) : requestedAt;
        return "garmin-sync:user:" + userId + ":" + trigger + ":" + day;
    }
}

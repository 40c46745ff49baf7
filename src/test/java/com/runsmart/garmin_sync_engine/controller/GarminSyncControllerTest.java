package com.runsmart.garmin_sync_engine.controller;

import com.runsmart.garmin_sync_engine.model.SyncRequest;
import com.runsmart.garmin_sync_engine.model.SyncResult;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.service.GarminSyncOrchestrator;
import com.runsmart.garmin_sync_engine.service.GarminTokenStore;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GarminSyncControllerTest {

    private final GarminSyncOrchestrator orchestrator = mock(GarminSyncOrchestrator.class);
    private final GarminTokenStore tokenStore = mock(GarminTokenStore.class);
    private final MockMvc mockMvc = MockMvcBuilders
            .standaloneSetup(new GarminSyncController(orchestrator, tokenStore))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

    @Test
    void cooldown_sets_retry_after() throws Exception {
        when(orchestrator.syncUser(any())).thenReturn(SyncResult.rateLimited(null, "cooldown", 360L));

        mockMvc.perform(post("/api/devices/garmin/sync").header(GarminSyncController.USER_HEADER, "7"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "360"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(360));
    }

    @Test
    void trigger_and_since_are_passed_through() throws Exception {
        when(orchestrator.syncUser(any())).thenReturn(new SyncResult(200, true, false, null, 3, 2, false, null,
                null, null, 1, true, List.of()));

        mockMvc.perform(post("/api/devices/garmin/sync")
                        .header(GarminSyncController.USER_HEADER, "7")
                        .param("trigger", "backfill")
                        .param("since", "2026-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.activitiesUpserted").value(3));

        verify(orchestrator).syncUser(new SyncRequest(7L, SyncTrigger.BACKFILL, "2026-01-01T00:00:00Z"));
    }

    @Test
    void missing_user_header_is_a_bad_request() throws Exception {
        mockMvc.perform(post("/api/devices/garmin/sync"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void disconnect_clears_the_connection() throws Exception {
        mockMvc.perform(delete("/api/devices/garmin/connection").header(GarminSyncController.USER_HEADER, "7"))
                .andExpect(status().isNoContent());

        verify(tokenStore).disconnect(7L);
    }
}

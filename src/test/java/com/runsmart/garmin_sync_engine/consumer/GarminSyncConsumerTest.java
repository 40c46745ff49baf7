package com.runsmart.garmin_sync_engine.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runsmart.garmin_sync_engine.model.SyncRequest;
import com.runsmart.garmin_sync_engine.model.SyncResult;
import com.runsmart.garmin_sync_engine.model.SyncTrigger;
import com.runsmart.garmin_sync_engine.service.GarminSyncOrchestrator;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GarminSyncConsumerTest {

    private final GarminSyncOrchestrator orchestrator = mock(GarminSyncOrchestrator.class);
    private final GarminSyncConsumer consumer = new GarminSyncConsumer(orchestrator, new ObjectMapper());

    @Test
    void nightly_job_runs_a_nightly_sync() {
        when(orchestrator.syncUser(any())).thenReturn(SyncResult.notConnected());

        consumer.consume("{\"userId\":7,\"trigger\":\"nightly\",\"requestedAt\":\"2026-03-10T03:00:00Z\"}");

        verify(orchestrator).syncUser(new SyncRequest(7L, SyncTrigger.NIGHTLY, null));
    }

    @Test
    void job_without_user_is_dropped() {
        consumer.consume("{\"trigger\":\"nightly\"}");
        consumer.consume("{broken");

        verifyNoInteractions(orchestrator);
    }
}

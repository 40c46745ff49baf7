package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.model.QueueResult;
import com.runsmart.garmin_sync_engine.model.SyncJobPayload;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PeriodicSyncServiceTest {

    private final GarminTokenStore tokenStore = mock(GarminTokenStore.class);
    private final GarminQueuePublisher queuePublisher = mock(GarminQueuePublisher.class);
    private final PeriodicSyncService service = new PeriodicSyncService(tokenStore, queuePublisher,
            Clock.fixed(Instant.parse("2026-03-10T03:00:00Z"), ZoneOffset.UTC));

    @Test
    void queues_one_nightly_job_per_connected_user() {
        when(tokenStore.listConnectedUserIds()).thenReturn(List.of(1L, 2L, 3L));
        when(queuePublisher.enqueueSync(any())).thenReturn(new QueueResult(true, "sync", null));
        when(queuePublisher.enqueueSync(new SyncJobPayload(2L, "nightly", null, "2026-03-10T03:00:00Z")))
                .thenReturn(new QueueResult(false, "sync", "broker down"));

        assertEquals(2, service.triggerNightlySync());

        verify(queuePublisher).enqueueSync(new SyncJobPayload(1L, "nightly", null, "2026-03-10T03:00:00Z"));
        verify(queuePublisher).enqueueSync(new SyncJobPayload(3L, "nightly", null, "2026-03-10T03:00:00Z"));
    }

    @Test
    void nothing_to_do_without_connections() {
        when(tokenStore.listConnectedUserIds()).thenReturn(List.of());

        assertEquals(0, service.triggerNightlySync());
        verifyNoInteractions(queuePublisher);
    }
}

package com.flagship.bank_transfer.observability;

import com.flagship.bank_transfer.outbox.OutboxService;
import com.flagship.bank_transfer.session.MutableClock;
import com.flagship.bank_transfer.session.SessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetricsSchedulerTest {

    private OutboxService outboxService;
    private SessionManager sessionManager;
    private SimpleMeterRegistry registry;
    private OutboxMetrics outboxMetrics;
    private MetricsScheduler scheduler;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
        sessionManager = new SessionManager(new MutableClock(Instant.parse("2024-05-01T10:00:00Z")),
                Duration.ofMinutes(30));
        registry = new SimpleMeterRegistry();
        outboxMetrics = new OutboxMetrics(outboxService, registry, 5);
        scheduler = new MetricsScheduler(outboxMetrics, sessionManager, registry);
    }

    @Test
    @DisplayName("Refresh samples the outbox backlog and open sessions into gauges")
    void testRefreshUpdatesGauges() {
        when(outboxService.countUnpublished()).thenReturn(7L);
        when(outboxService.oldestUnpublishedAgeSeconds()).thenReturn(42L);
        when(outboxService.countDeadLetters(5)).thenReturn(1L);
        sessionManager.createSession("alice");
        sessionManager.createSession("bob");

        scheduler.refresh();

        OutboxMetrics.Backlog backlog = outboxMetrics.getBacklog();
        assertEquals(7L, backlog.getPending());
        assertEquals(42L, backlog.getOldestAgeSeconds());
        assertEquals(1L, backlog.getDeadLetters());
        assertEquals(2, scheduler.getActiveSessions());

        assertEquals(7.0, registry.get("transfers.outbox.pending").gauge().value());
        assertEquals(42.0, registry.get("transfers.outbox.oldest.age.seconds").gauge().value());
        assertEquals(1.0, registry.get("transfers.outbox.dead_letters").gauge().value());
        assertEquals(2.0, registry.get("sessions.active").gauge().value());
    }

    @Test
    @DisplayName("A store failure keeps the previous backlog snapshot")
    void testRefreshKeepsSnapshotOnStoreFailure() {
        when(outboxService.countUnpublished()).thenReturn(3L);
        scheduler.refresh();

        when(outboxService.countUnpublished()).thenThrow(new DataAccessResourceFailureException("down"));
        assertDoesNotThrow(scheduler::refresh);

        assertEquals(3L, outboxMetrics.getBacklog().getPending());
        assertEquals(3.0, registry.get("transfers.outbox.pending").gauge().value());
    }
}

package com.flagship.bank_transfer.observability;

import com.flagship.bank_transfer.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Outbox backlog gauges and per-event send counters.
 *
 * <ul>
 *   <li>{@code transfers.outbox.pending}: events not yet on Kafka</li>
 *   <li>{@code transfers.outbox.oldest.age.seconds}: age of the oldest pending event</li>
 *   <li>{@code transfers.outbox.dead_letters}: pending events past the retry limit</li>
 *   <li>{@code transfers.outbox.sends{event_type,outcome}}: publisher attempts</li>
 * </ul>
 *
 * Gauges read the last {@link Backlog} snapshot taken by {@link #refresh()}, so a
 * Prometheus scrape never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    public enum Outcome {
        PUBLISHED, FAILED, DEAD_LETTERED
    }

    @lombok.Value
    public static class Backlog {
        private static final Backlog EMPTY = new Backlog(0, 0, 0);

        long pending;
        long oldestAgeSeconds;
        long deadLetters;
    }

    private final OutboxService outboxService;
    private final MeterRegistry registry;
    private final int maxRetries;
    private final AtomicReference<Backlog> backlog = new AtomicReference<>(Backlog.EMPTY);

    public OutboxMetrics(OutboxService outboxService, MeterRegistry registry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.registry = registry;
        this.maxRetries = maxRetries;

        gauge("transfers.outbox.pending", "Transfer events waiting for Kafka", Backlog::getPending);
        gauge("transfers.outbox.oldest.age.seconds", "Age of the oldest waiting transfer event",
                Backlog::getOldestAgeSeconds);
        gauge("transfers.outbox.dead_letters", "Waiting transfer events past the retry limit",
                Backlog::getDeadLetters);
    }

    /**
     * Takes a new backlog snapshot. A store failure keeps the previous one.
     */
    public void refresh() {
        try {
            Backlog snapshot = new Backlog(
                    outboxService.countUnpublished(),
                    outboxService.oldestUnpublishedAgeSeconds(),
                    outboxService.countDeadLetters(maxRetries));
            backlog.set(snapshot);
            log.debug("Outbox backlog: {}", snapshot);
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox backlog metrics: {}", e.getMessage());
        }
    }

    public Backlog getBacklog() {
        return backlog.get();
    }

    public void record(String eventType, Outcome outcome) {
        registry.counter("transfers.outbox.sends",
                "event_type", eventType,
                "outcome", outcome.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    private void gauge(String name, String description, ToDoubleFunction<Backlog> reading) {
        Gauge.builder(name, backlog, ref -> reading.applyAsDouble(ref.get()))
                .description(description)
                .register(registry);
    }
}

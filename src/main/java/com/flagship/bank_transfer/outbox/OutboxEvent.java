package com.flagship.bank_transfer.outbox;

import com.flagship.bank_transfer.ledger.event.TransferEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A transfer event waiting in (or already drained from) the outbox table.
 *
 * The row id is the event's own id, so consumers can deduplicate redeliveries
 * with the {@code event_id} header alone.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String aggregateId;        // transfer id, also the Kafka record key
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Instant lastAttemptAt;

    static OutboxEvent of(TransferEvent event, String payload, Instant now) {
        return new OutboxEvent(
            event.getEventId(),
            OutboxService.AGGREGATE_TRANSFER,
            event.getTransferId(),
            event.getEventType(),
            payload,
            now,
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

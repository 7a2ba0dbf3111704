package com.flagship.bank_transfer.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a transfer reaching a terminal status, written to the outbox in
 * the same transaction as the status change.
 */
public interface TransferEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    String getTransferId();

    Instant getOccurredAt();

    String getEventType();
}

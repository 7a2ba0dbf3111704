package com.flagship.bank_transfer.ledger.event;

import com.flagship.bank_transfer.ledger.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a transfer is finalized FAILED. No balance moved.
 */
@Value
public class TransferFailedEvent implements TransferEvent {
    UUID eventId;
    String transferId;
    String fromUser;
    String toUser;
    BigDecimal amount;
    BigDecimal fee;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferFailedEvent fromTransfer(Transfer transfer) {
        return new TransferFailedEvent(
            UUID.randomUUID(),
            transfer.getTransferId(),
            transfer.getFromUser(),
            transfer.getToUser(),
            transfer.getAmount(),
            transfer.getFee(),
            transfer.getReason(),
            transfer.getUpdatedAt()
        );
    }
}

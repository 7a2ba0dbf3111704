package com.flagship.bank_transfer.ledger.event;

import com.flagship.bank_transfer.ledger.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransferCompletedEvent implements TransferEvent {
    UUID eventId;
    String transferId;
    String fromUser;
    String toUser;
    BigDecimal amount;
    BigDecimal fee;
    String reference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent fromTransfer(Transfer transfer) {
        return new TransferCompletedEvent(
            UUID.randomUUID(),
            transfer.getTransferId(),
            transfer.getFromUser(),
            transfer.getToUser(),
            transfer.getAmount(),
            transfer.getFee(),
            transfer.getReference(),
            transfer.getUpdatedAt()
        );
    }
}

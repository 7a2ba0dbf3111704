package com.flagship.bank_transfer.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit record. {@code logId} is assigned by the store and is
 * null until the entry has been appended.
 */
@Value
public class AuditLogEntry {
    Long logId;
    AuditOperation operation;
    String username;
    String details;
    Instant timestamp;

    public static AuditLogEntry of(AuditOperation operation, String username, String details, Instant timestamp) {
        return new AuditLogEntry(null, operation, username, details, timestamp);
    }
}

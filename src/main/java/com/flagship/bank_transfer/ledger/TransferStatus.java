package com.flagship.bank_transfer.ledger;

/**
 * Lifecycle of a transfer. COMPLETED and FAILED are terminal.
 */
public enum TransferStatus {
    PENDING,
    COMPLETED,
    FAILED
}

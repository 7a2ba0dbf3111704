package com.flagship.bank_transfer.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of {@link LedgerStore#applyTransfer}.
 *
 * A rejected apply means the sender's balance was re-checked under lock and
 * found short; no balance was touched and the transfer was finalized FAILED.
 */
@Value
public class ApplyResult {
    boolean committed;
    Transfer transfer;
    BigDecimal senderBalance;

    public static ApplyResult committed(Transfer transfer, BigDecimal senderBalance) {
        return new ApplyResult(true, transfer, senderBalance);
    }

    public static ApplyResult insufficientFunds(Transfer transfer, BigDecimal senderBalance) {
        return new ApplyResult(false, transfer, senderBalance);
    }
}

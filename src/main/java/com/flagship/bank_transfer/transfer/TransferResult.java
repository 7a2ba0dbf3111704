package com.flagship.bank_transfer.transfer;

import com.flagship.bank_transfer.ledger.Transfer;
import com.flagship.bank_transfer.ledger.TransferStatus;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What a transfer submission reports back: the record id, the fee charged (or
 * that would have been charged), the sender's balance afterwards and the
 * terminal status. {@code reason} is set only for FAILED.
 */
@Value
public class TransferResult {
    String transferId;
    BigDecimal fee;
    BigDecimal newSenderBalance;
    TransferStatus status;
    String reason;

    public static TransferResult of(Transfer transfer, BigDecimal senderBalance) {
        return new TransferResult(
            transfer.getTransferId(),
            transfer.getFee(),
            senderBalance,
            transfer.getStatus(),
            transfer.getReason()
        );
    }

    public boolean isCompleted() {
        return status == TransferStatus.COMPLETED;
    }
}

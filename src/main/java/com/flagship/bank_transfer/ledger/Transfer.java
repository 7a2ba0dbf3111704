package com.flagship.bank_transfer.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transfer domain object with an explicit state machine.
 *
 * Transitions: PENDING -> COMPLETED, PENDING -> FAILED. Terminal records never
 * change again. Amount and fee are fixed at creation; every transition returns
 * a new instance and {@code updatedAt} never moves backwards.
 */
@Value
public class Transfer {

    public static final String REASON_INSUFFICIENT_FUNDS = "InsufficientFunds";
    public static final String REASON_STORE_UNAVAILABLE = "StoreUnavailable";

    private static final String ID_PREFIX = "tr_";

    String transferId;
    String fromUser;
    String toUser;
    BigDecimal amount;
    BigDecimal fee;
    String reference;
    TransferStatus status;
    String reason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING transfer with a fresh id.
     */
    public static Transfer create(String fromUser, String toUser, BigDecimal amount, BigDecimal fee,
                                  String reference, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive");
        }
        if (fee == null || fee.signum() < 0) {
            throw new IllegalArgumentException("Transfer fee cannot be negative");
        }
        return new Transfer(
            newTransferId(),
            fromUser,
            toUser,
            amount,
            fee,
            reference,
            TransferStatus.PENDING,
            null,
            now,
            now
        );
    }

    public static String newTransferId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Transitions to COMPLETED. Only valid from PENDING.
     *
     * @throws IllegalStateException if the transfer is already terminal
     */
    public Transfer complete(Instant now) {
        if (this.status != TransferStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot complete transfer %s in %s status", transferId, status));
        }
        return withStatus(TransferStatus.COMPLETED, null, now);
    }

    /**
     * Transitions to FAILED with a reason. Only valid from PENDING.
     *
     * @throws IllegalStateException if the transfer is already terminal
     */
    public Transfer fail(String reason, Instant now) {
        if (this.status != TransferStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot fail transfer %s in %s status", transferId, status));
        }
        return withStatus(TransferStatus.FAILED, reason, now);
    }

    public boolean isTerminal() {
        return status == TransferStatus.COMPLETED || status == TransferStatus.FAILED;
    }

    public boolean canTransitionTo(TransferStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case PENDING -> target == TransferStatus.COMPLETED || target == TransferStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Amount plus fee: what the sender is debited.
     */
    public BigDecimal getTotalDebit() {
        return amount.add(fee);
    }

    public boolean involves(String username) {
        return fromUser.equals(username) || toUser.equals(username);
    }

    private Transfer withStatus(TransferStatus newStatus, String newReason, Instant now) {
        Instant next = now.isAfter(updatedAt) ? now : updatedAt;
        return new Transfer(
            transferId,
            fromUser,
            toUser,
            amount,
            fee,
            reference,
            newStatus,
            newReason,
            createdAt,
            next
        );
    }
}

package com.flagship.bank_transfer.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for transfer records.
 *
 * Only status, reason and updatedAt are mutable, and only through
 * {@link #updateFromDomain}. The idempotency key is a persistence concern kept
 * out of the {@link Transfer} domain object; it is unique per sender.
 */
@Entity
@Table(name = "transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity implements Persistable<String> {

    @Id
    @Column(name = "transfer_id", nullable = false, updatable = false, length = 40)
    private String transferId;

    @Column(name = "from_user", nullable = false, updatable = false, length = 64)
    private String fromUser;

    @Column(name = "to_user", nullable = false, updatable = false, length = 64)
    private String toUser;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "fee", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal fee;

    @Column(name = "reference", updatable = false)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TransferStatus status;

    @Column(name = "reason")
    private String reason;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    static TransferEntity fromDomain(Transfer transfer, String idempotencyKey) {
        return new TransferEntity(
            transfer.getTransferId(),
            transfer.getFromUser(),
            transfer.getToUser(),
            transfer.getAmount(),
            transfer.getFee(),
            transfer.getReference(),
            transfer.getStatus(),
            transfer.getReason(),
            idempotencyKey,
            transfer.getCreatedAt(),
            transfer.getUpdatedAt(),
            true
        );
    }

    public Transfer toDomain() {
        return new Transfer(
            transferId,
            fromUser,
            toUser,
            amount,
            fee,
            reference,
            status,
            reason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields of a transitioned domain object.
     */
    void updateFromDomain(Transfer transfer) {
        if (!transfer.getTransferId().equals(transferId)) {
            throw new IllegalArgumentException("Transfer id mismatch: " + transfer.getTransferId());
        }
        this.status = transfer.getStatus();
        this.reason = transfer.getReason();
        this.updatedAt = transfer.getUpdatedAt();
    }

    @Override
    public String getId() {
        return transferId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}

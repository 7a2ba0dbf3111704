package com.flagship.bank_transfer.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * Balance row, one per user.
 *
 * No setters: the balance only moves through {@link #debit} and {@link #credit},
 * which refuse to take it below zero. The table carries a matching CHECK constraint.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity implements Persistable<String> {

    @Id
    @Column(name = "username", nullable = false, updatable = false, length = 64)
    private String username;

    @Column(name = "balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    static AccountEntity open(String username, BigDecimal openingBalance, Instant now) {
        if (openingBalance.signum() < 0) {
            throw new IllegalArgumentException("Opening balance cannot be negative");
        }
        return new AccountEntity(username, openingBalance, now, now, true);
    }

    boolean covers(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }

    void debit(BigDecimal amount, Instant now) {
        if (!covers(amount)) {
            throw new IllegalStateException(
                String.format("Debit of %s would overdraw account %s (balance %s)", amount, username, balance));
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = now;
    }

    void credit(BigDecimal amount, Instant now) {
        this.balance = balance.add(amount);
        this.updatedAt = now;
    }

    @Override
    public String getId() {
        return username;
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

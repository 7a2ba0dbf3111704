package com.flagship.bank_transfer.ledger;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Durable owner of users, balances, transfer records and the audit log.
 *
 * Every balance mutation goes through {@link #applyTransfer}, which is the only
 * place where money moves and the only way a transfer becomes COMPLETED.
 * Implementations signal an unreachable or aborted data tier with Spring's
 * {@link org.springframework.dao.DataAccessException} or
 * {@link org.springframework.transaction.TransactionException}.
 */
public interface LedgerStore {

    Optional<User> getUser(String username);

    /**
     * Checks a secret against the stored credential verifier. Unknown users
     * simply verify as false.
     */
    boolean verifyCredential(String username, String secret);

    /**
     * Provisions a user with a zero-balance account.
     *
     * @return false if the username is already taken
     */
    boolean createUser(String username, String secret, String email);

    /**
     * Provisions a user with an account holding {@code openingBalance}.
     *
     * @return false if the username is already taken
     */
    boolean createUser(String username, String secret, String email, BigDecimal openingBalance);

    Optional<BigDecimal> getBalance(String username);

    /**
     * Persists a new transfer record. A terminal (FAILED) record is audited and
     * its event emitted in the same transaction.
     *
     * @param idempotencyKey optional, unique per sender
     * @throws org.springframework.dao.DataIntegrityViolationException if the sender already used the key
     */
    Transfer createTransfer(Transfer transfer, String idempotencyKey);

    /**
     * Atomic apply: debits {@code fromUser} by {@code debitAmount}, credits
     * {@code toUser} by {@code creditAmount} and marks the PENDING transfer
     * COMPLETED, all in one transaction together with its audit entry.
     *
     * Both account rows are locked in username order before anything is written.
     * If the sender's locked balance no longer covers the debit, nothing moves
     * and the transfer is finalized FAILED with reason {@code InsufficientFunds}.
     */
    ApplyResult applyTransfer(String fromUser, String toUser, BigDecimal debitAmount,
                              BigDecimal creditAmount, Transfer transfer);

    Optional<Transfer> getTransfer(String transferId);

    Optional<Transfer> findTransferByIdempotencyKey(String fromUser, String idempotencyKey);

    /**
     * Finalizes a PENDING transfer as FAILED. COMPLETED is only reachable
     * through {@link #applyTransfer}.
     *
     * @throws IllegalArgumentException if the status is not FAILED or the transfer does not exist
     * @throws IllegalStateException if the transfer is already terminal
     */
    Transfer updateTransfer(String transferId, TransferStatus status, String reason);

    /**
     * Transfers sent or received by the user, newest first.
     */
    List<Transfer> getTransfersByUser(String username);

    void appendAudit(AuditLogEntry entry);

    /**
     * Newest entries first.
     */
    List<AuditLogEntry> getAuditLogs(int limit);

    StoreHealth healthCheck();
}

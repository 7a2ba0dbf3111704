package com.flagship.bank_transfer.ledger;

import com.flagship.bank_transfer.ledger.event.TransferCompletedEvent;
import com.flagship.bank_transfer.ledger.event.TransferEvent;
import com.flagship.bank_transfer.ledger.event.TransferFailedEvent;
import com.flagship.bank_transfer.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Relational ledger store: JPA for users, accounts and transfers, JDBC for the
 * append-only audit log.
 *
 * Every terminal transfer status is written together with its audit entry and
 * its outbox event, so a committed outcome is always queryable and always announced.
 * All writes go through Spring Data repositories or {@link JdbcTemplate}, so
 * persistence failures reach callers as Spring {@link DataAccessException}s.
 */
@Service
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final TransferRepository transferRepository;
    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public JpaLedgerStore(UserRepository userRepository,
                          AccountRepository accountRepository,
                          TransferRepository transferRepository,
                          JdbcTemplate jdbcTemplate,
                          OutboxService outboxService,
                          PasswordEncoder passwordEncoder,
                          Clock clock) {
        this.userRepository = userRepository;
        this.accountRepository = accountRepository;
        this.transferRepository = transferRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    // ==================== Users ====================

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUser(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return userRepository.findById(username).map(UserEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean verifyCredential(String username, String secret) {
        if (username == null || secret == null) {
            return false;
        }
        return userRepository.findById(username)
                .map(user -> passwordEncoder.matches(secret, user.getPasswordHash()))
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean createUser(String username, String secret, String email) {
        return createUser(username, secret, email, BigDecimal.ZERO.setScale(2));
    }

    @Override
    @Transactional
    public boolean createUser(String username, String secret, String email, BigDecimal openingBalance) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (username.length() > User.MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Username longer than " + User.MAX_USERNAME_LENGTH + " characters");
        }
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        if (userRepository.existsById(username)) {
            log.debug("User {} already exists", username);
            return false;
        }

        Instant now = clock.instant();
        userRepository.saveAndFlush(UserEntity.create(username, passwordEncoder.encode(secret), email, now));
        accountRepository.saveAndFlush(AccountEntity.open(username, openingBalance, now));

        appendAudit(AuditLogEntry.of(AuditOperation.USER_CREATED, username,
                "opening_balance=" + openingBalance.toPlainString(), now));
        log.info("User created: {}", username);
        return true;
    }

    // ==================== Balances ====================

    @Override
    @Transactional(readOnly = true)
    public Optional<BigDecimal> getBalance(String username) {
        return accountRepository.findBalance(username);
    }

    // ==================== Transfers ====================

    @Override
    @Transactional
    public Transfer createTransfer(Transfer transfer, String idempotencyKey) {
        if (transfer.getStatus() == TransferStatus.COMPLETED) {
            throw new IllegalArgumentException("A transfer can only become COMPLETED through applyTransfer");
        }
        transferRepository.saveAndFlush(TransferEntity.fromDomain(transfer, idempotencyKey));

        if (transfer.getStatus() == TransferStatus.FAILED) {
            recordOutcome(transfer);
        }
        log.debug("Transfer record created: {} status={}", transfer.getTransferId(), transfer.getStatus());
        return transfer;
    }

    @Override
    @Transactional
    public ApplyResult applyTransfer(String fromUser, String toUser, BigDecimal debitAmount,
                                     BigDecimal creditAmount, Transfer transfer) {
        if (fromUser.equals(toUser)) {
            throw new IllegalArgumentException("Sender and recipient must differ");
        }
        if (debitAmount.signum() <= 0 || creditAmount.signum() <= 0) {
            throw new IllegalArgumentException("Debit and credit amounts must be positive");
        }

        // Fixed lock order: two opposite transfers cannot wait on each other.
        boolean senderFirst = fromUser.compareTo(toUser) < 0;
        AccountEntity firstLocked = lockAccount(senderFirst ? fromUser : toUser);
        AccountEntity secondLocked = lockAccount(senderFirst ? toUser : fromUser);
        AccountEntity sender = senderFirst ? firstLocked : secondLocked;
        AccountEntity recipient = senderFirst ? secondLocked : firstLocked;

        TransferEntity record = transferRepository.findByIdForUpdate(transfer.getTransferId())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Transfer not found: " + transfer.getTransferId()));
        Transfer current = record.toDomain();
        if (current.isTerminal()) {
            throw new IllegalStateException(
                    String.format("Transfer %s is already %s", current.getTransferId(), current.getStatus()));
        }
        Instant now = clock.instant();

        if (!sender.covers(debitAmount)) {
            Transfer failed = current.fail(Transfer.REASON_INSUFFICIENT_FUNDS, now);
            record.updateFromDomain(failed);
            transferRepository.flush();
            recordOutcome(failed);
            log.warn("Transfer {} rejected under lock: balance {} < {}",
                    failed.getTransferId(), sender.getBalance(), debitAmount);
            return ApplyResult.insufficientFunds(failed, sender.getBalance());
        }

        sender.debit(debitAmount, now);
        recipient.credit(creditAmount, now);
        Transfer completed = current.complete(now);
        record.updateFromDomain(completed);
        transferRepository.flush();
        recordOutcome(completed);

        return ApplyResult.committed(completed, sender.getBalance());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transfer> getTransfer(String transferId) {
        if (transferId == null) {
            return Optional.empty();
        }
        return transferRepository.findById(transferId).map(TransferEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transfer> findTransferByIdempotencyKey(String fromUser, String idempotencyKey) {
        return transferRepository.findByFromUserAndIdempotencyKey(fromUser, idempotencyKey)
                .map(TransferEntity::toDomain);
    }

    @Override
    @Transactional
    public Transfer updateTransfer(String transferId, TransferStatus status, String reason) {
        if (status != TransferStatus.FAILED) {
            throw new IllegalArgumentException("Only FAILED can be set directly, got " + status);
        }
        TransferEntity record = transferRepository.findByIdForUpdate(transferId)
                .orElseThrow(() -> new IllegalArgumentException("Transfer not found: " + transferId));

        Transfer failed = record.toDomain().fail(reason, clock.instant());
        record.updateFromDomain(failed);
        transferRepository.flush();
        recordOutcome(failed);
        return failed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transfer> getTransfersByUser(String username) {
        return transferRepository.findByParticipant(username)
                .stream()
                .map(TransferEntity::toDomain)
                .toList();
    }

    // ==================== Audit ====================

    @Override
    @Transactional
    public void appendAudit(AuditLogEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO audit_logs (operation, username, details, logged_at) VALUES (?, ?, ?, ?)",
            entry.getOperation().name(),
            entry.getUsername(),
            entry.getDetails(),
            OffsetDateTime.ofInstant(entry.getTimestamp(), ZoneOffset.UTC)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogEntry> getAuditLogs(int limit) {
        return jdbcTemplate.query(
            "SELECT log_id, operation, username, details, logged_at FROM audit_logs " +
            "ORDER BY log_id DESC LIMIT ?",
            auditRowMapper(),
            limit
        );
    }

    // ==================== Health ====================

    @Override
    public StoreHealth healthCheck() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return StoreHealth.OK;
        } catch (DataAccessException e) {
            log.warn("Ledger store health check failed: {}", e.getMessage());
            return StoreHealth.DEGRADED;
        }
    }

    // ==================== Internals ====================

    private AccountEntity lockAccount(String username) {
        return accountRepository.findByUsernameForUpdate(username)
                .orElseThrow(() -> new IllegalArgumentException("Account not found: " + username));
    }

    /**
     * Audit entry and outbox event for a terminal transfer, inside the current transaction.
     */
    private void recordOutcome(Transfer transfer) {
        AuditOperation operation;
        TransferEvent event;
        if (transfer.getStatus() == TransferStatus.COMPLETED) {
            operation = AuditOperation.TRANSFER_COMPLETED;
            event = TransferCompletedEvent.fromTransfer(transfer);
        } else {
            operation = AuditOperation.TRANSFER_FAILED;
            event = TransferFailedEvent.fromTransfer(transfer);
        }

        appendAudit(AuditLogEntry.of(operation, transfer.getFromUser(),
                describe(transfer), transfer.getUpdatedAt()));
        outboxService.enqueue(event);
    }

    private static String describe(Transfer transfer) {
        StringBuilder details = new StringBuilder()
                .append("transfer_id=").append(transfer.getTransferId())
                .append(", to=").append(transfer.getToUser())
                .append(", amount=").append(transfer.getAmount().toPlainString())
                .append(", fee=").append(transfer.getFee().toPlainString());
        if (transfer.getReason() != null) {
            details.append(", reason=").append(transfer.getReason());
        }
        return details.toString();
    }

    private RowMapper<AuditLogEntry> auditRowMapper() {
        return (rs, rowNum) -> new AuditLogEntry(
            rs.getLong("log_id"),
            AuditOperation.valueOf(rs.getString("operation")),
            rs.getString("username"),
            rs.getString("details"),
            rs.getObject("logged_at", OffsetDateTime.class).toInstant()
        );
    }
}

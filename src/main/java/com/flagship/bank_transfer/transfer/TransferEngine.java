package com.flagship.bank_transfer.transfer;

import com.flagship.bank_transfer.exception.BankingException;
import com.flagship.bank_transfer.fee.FeeCalculator;
import com.flagship.bank_transfer.ledger.ApplyResult;
import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.Transfer;
import com.flagship.bank_transfer.ledger.TransferStatus;
import com.flagship.bank_transfer.observability.CorrelationContext;
import com.flagship.bank_transfer.observability.TransferMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Validates and executes transfers. The only component that moves money.
 *
 * Submission order (first failing check wins, nothing is written before the
 * amount has been validated):
 * <ol>
 *   <li>idempotency key, when given, must fit the store ({@code INVALID_IDEMPOTENCY_KEY});
 *       a key the sender already used replays the original result</li>
 *   <li>recipient must exist ({@code UNKNOWN_RECIPIENT})</li>
 *   <li>recipient must not be the sender ({@code SELF_TRANSFER_NOT_ALLOWED})</li>
 *   <li>amount must be a positive decimal with at most 2 fraction digits ({@code INVALID_AMOUNT})</li>
 *   <li>fee from {@link FeeCalculator}</li>
 *   <li>sender balance must cover amount + fee, otherwise a FAILED record with
 *       reason {@code InsufficientFunds} is persisted and returned</li>
 *   <li>PENDING record, then the ledger store's atomic apply</li>
 * </ol>
 *
 * Ledger store failures surface as {@code STORE_UNAVAILABLE}; nothing is retried.
 * A PENDING record left behind by a failed apply is finalized FAILED with reason
 * {@code StoreUnavailable} when the store still accepts that write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferEngine {

    private static final int MAX_INTEGER_DIGITS = 17;

    /**
     * Width of the {@code transfers.idempotency_key} column.
     */
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final LedgerStore ledgerStore;
    private final FeeCalculator feeCalculator;
    private final IdempotencyService idempotencyService;
    private final TransferMetrics metrics;
    private final Clock clock;

    public TransferResult submitTransfer(String actingUser, String toUser, String amount, String reference) {
        return submitTransfer(actingUser, toUser, amount, reference, null);
    }

    /**
     * Submits a transfer with the amount as exact-decimal text.
     *
     * @param idempotencyKey optional; a key the sender already used returns the original result
     */
    public TransferResult submitTransfer(String actingUser, String toUser, String amount,
                                         String reference, String idempotencyKey) {
        return metrics.time("submit", () -> doSubmit(actingUser, toUser, () -> parseAmount(amount),
                reference, idempotencyKey));
    }

    public TransferResult submitTransfer(String actingUser, String toUser, BigDecimal amount,
                                         String reference, String idempotencyKey) {
        return metrics.time("submit", () -> doSubmit(actingUser, toUser, () -> validateAmount(amount),
                reference, idempotencyKey));
    }

    /**
     * Returns a transfer the caller sent or received.
     *
     * @throws BankingException {@code NOT_FOUND} or {@code FORBIDDEN}
     */
    public Transfer getTransferStatus(String actingUser, String transferId) {
        Transfer transfer = store("getTransfer", () -> ledgerStore.getTransfer(transferId))
                .orElseThrow(() -> BankingException.transferNotFound(transferId));
        if (!transfer.involves(actingUser)) {
            log.warn("User {} asked for transfer {} they are not party to", actingUser, transferId);
            throw BankingException.forbidden(transferId);
        }
        return transfer;
    }

    public List<Transfer> listTransfers(String actingUser) {
        return store("getTransfersByUser", () -> ledgerStore.getTransfersByUser(actingUser));
    }

    // ==================== Submission ====================

    private TransferResult doSubmit(String actingUser, String toUser, AmountSource amountSource,
                                    String reference, String idempotencyKey) {
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        if (key != null && key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw BankingException.invalidIdempotencyKey(MAX_IDEMPOTENCY_KEY_LENGTH);
        }

        if (key != null) {
            Optional<Transfer> existing = store("findIdempotent",
                    () -> idempotencyService.findExisting(actingUser, key));
            if (existing.isPresent()) {
                return replay(actingUser, existing.get());
            }
        }

        if (toUser == null || store("getUser", () -> ledgerStore.getUser(toUser)).isEmpty()) {
            throw BankingException.unknownRecipient(toUser);
        }
        if (toUser.equals(actingUser)) {
            throw BankingException.selfTransfer();
        }
        BigDecimal amount = amountSource.get();
        BigDecimal fee = feeCalculator.fee(amount);
        BigDecimal totalDebit = amount.add(fee);

        BigDecimal balance = store("getBalance", () -> ledgerStore.getBalance(actingUser))
                .orElseThrow(() -> new IllegalStateException("No account for user " + actingUser));

        Transfer pending = Transfer.create(actingUser, toUser, amount, fee, reference, clock.instant());
        CorrelationContext.bindTransfer(pending.getTransferId());
        try {
            if (balance.compareTo(totalDebit) < 0) {
                return rejectInsufficientFunds(pending, balance, key);
            }
            return execute(pending, key);
        } catch (DataIntegrityViolationException e) {
            if (key == null) {
                throw storeUnavailable("createTransfer", e);
            }
            // Same key submitted concurrently: the other submission's record wins.
            Transfer original = store("findIdempotent",
                    () -> ledgerStore.findTransferByIdempotencyKey(actingUser, key))
                    .orElseThrow(() -> storeUnavailable("createTransfer", e));
            return replay(actingUser, original);
        } finally {
            CorrelationContext.unbindTransfer();
        }
    }

    private TransferResult rejectInsufficientFunds(Transfer pending, BigDecimal balance, String key) {
        Transfer failed = pending.fail(Transfer.REASON_INSUFFICIENT_FUNDS, clock.instant());
        createRecord(failed, key);

        log.warn("Transfer {} failed: insufficient funds (balance {}, required {})",
                failed.getTransferId(), balance, failed.getTotalDebit());
        metrics.recordTransfer(failed.getStatus().name(), failed.getReason());
        return TransferResult.of(failed, balance);
    }

    private TransferResult execute(Transfer pending, String key) {
        createRecord(pending, key);

        ApplyResult result;
        try {
            result = ledgerStore.applyTransfer(pending.getFromUser(), pending.getToUser(),
                    pending.getTotalDebit(), pending.getAmount(), pending);
        } catch (DataAccessException | TransactionException e) {
            BankingException failure = storeUnavailable("applyTransfer", e);
            markStoreFailure(pending, failure);
            throw failure;
        }

        Transfer finished = result.getTransfer();
        if (result.isCommitted()) {
            log.info("Transfer {} completed: {} -> {}, amount={}, fee={}",
                    finished.getTransferId(), finished.getFromUser(), finished.getToUser(),
                    finished.getAmount(), finished.getFee());
        } else {
            log.warn("Transfer {} failed at apply: {}", finished.getTransferId(), finished.getReason());
        }
        metrics.recordTransfer(finished.getStatus().name(), finished.getReason());
        return TransferResult.of(finished, result.getSenderBalance());
    }

    private void createRecord(Transfer transfer, String key) {
        try {
            ledgerStore.createTransfer(transfer, key);
        } catch (DataIntegrityViolationException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw storeUnavailable("createTransfer", e);
        }
        if (key != null) {
            idempotencyService.remember(transfer.getFromUser(), key, transfer.getTransferId());
        }
    }

    /**
     * Best-effort finalization of a PENDING record after a failed apply. A failure
     * here is attached to the reported exception.
     */
    private void markStoreFailure(Transfer pending, BankingException failure) {
        try {
            ledgerStore.updateTransfer(pending.getTransferId(), TransferStatus.FAILED,
                    Transfer.REASON_STORE_UNAVAILABLE);
            metrics.recordTransfer(TransferStatus.FAILED.name(), Transfer.REASON_STORE_UNAVAILABLE);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.error("Transfer {} left PENDING: could not record store failure", pending.getTransferId(), e);
        }
    }

    private TransferResult replay(String actingUser, Transfer original) {
        log.info("Idempotent replay of transfer {}", original.getTransferId());
        metrics.recordReplay();
        BigDecimal balance = store("getBalance", () -> ledgerStore.getBalance(actingUser))
                .orElseThrow(() -> new IllegalStateException("No account for user " + actingUser));
        return TransferResult.of(original, balance);
    }

    // ==================== Amounts ====================

    static BigDecimal parseAmount(String text) {
        if (text == null || text.isBlank()) {
            throw BankingException.invalidAmount("Invalid amount format");
        }
        String trimmed = text.trim();
        if (trimmed.indexOf('e') >= 0 || trimmed.indexOf('E') >= 0) {
            throw BankingException.invalidAmount("Invalid amount format");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw BankingException.invalidAmount("Invalid amount format");
        }
        return validateAmount(amount);
    }

    /**
     * Checks sign and precision and normalizes to 2 fraction digits.
     */
    static BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw BankingException.invalidAmount("Invalid amount format");
        }
        if (amount.signum() <= 0) {
            throw BankingException.invalidAmount("Amount must be greater than 0");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > FeeCalculator.MONEY_SCALE) {
            throw BankingException.invalidAmount("Amount must have at most 2 decimal places");
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw BankingException.invalidAmount("Amount exceeds the supported range");
        }
        return stripped.setScale(FeeCalculator.MONEY_SCALE);
    }

    // ==================== Store access ====================

    private <T> T store(String operation, StoreCall<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw storeUnavailable(operation, e);
        }
    }

    private BankingException storeUnavailable(String operation, Exception cause) {
        log.error("Ledger store failure during {}: {}", operation, cause.getMessage());
        metrics.recordStoreFailure(operation);
        return BankingException.storeUnavailable(operation, cause);
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T get();
    }

    @FunctionalInterface
    private interface AmountSource {
        BigDecimal get();
    }
}

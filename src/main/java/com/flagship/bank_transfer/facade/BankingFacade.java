package com.flagship.bank_transfer.facade;

import com.flagship.bank_transfer.exception.BankingException;
import com.flagship.bank_transfer.ledger.AuditLogEntry;
import com.flagship.bank_transfer.ledger.AuditOperation;
import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.Transfer;
import com.flagship.bank_transfer.ledger.User;
import com.flagship.bank_transfer.observability.CorrelationContext;
import com.flagship.bank_transfer.observability.TransferMetrics;
import com.flagship.bank_transfer.session.SessionManager;
import com.flagship.bank_transfer.transfer.TransferEngine;
import com.flagship.bank_transfer.transfer.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Customer-facing operations.
 *
 * Every token-bearing call validates the session first, so an unauthenticated
 * caller only ever sees {@code UNAUTHORIZED}, never a business-rule error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankingFacade {

    private final SessionManager sessionManager;
    private final TransferEngine transferEngine;
    private final LedgerStore ledgerStore;
    private final TransferMetrics metrics;
    private final Clock clock;

    /**
     * Verifies credentials and opens a session.
     *
     * @throws BankingException {@code INVALID_CREDENTIALS}, with the same message
     *         for unknown users and wrong passwords
     */
    public String login(String username, String password) {
        boolean verified = username != null
                && username.length() <= User.MAX_USERNAME_LENGTH
                && storeCall("verifyCredential", () -> ledgerStore.verifyCredential(username, password));
        if (!verified) {
            metrics.recordLogin(false);
            if (username != null && !username.isBlank()) {
                auditFailedLogin(username);
            }
            log.warn("Login failed for user {}", abbreviate(username));
            throw BankingException.invalidCredentials();
        }

        // No token is issued unless the audit entry was written.
        audit(AuditOperation.LOGIN_SUCCESS, username, "Login succeeded");
        String token = sessionManager.createSession(username);
        metrics.recordLogin(true);
        log.info("User {} logged in", username);
        return token;
    }

    /**
     * Ends a session. Unknown or expired tokens are accepted silently.
     */
    public void logout(String token) {
        String username;
        try {
            username = sessionManager.validate(token);
        } catch (BankingException e) {
            log.debug("Logout with unknown or expired session token");
            sessionManager.invalidate(token);
            return;
        }
        sessionManager.invalidate(token);
        audit(AuditOperation.LOGOUT, username, "Session closed");
        log.info("User {} logged out", username);
    }

    public BigDecimal getBalance(String token) {
        String username = authenticate(token);
        return storeCall("getBalance", () -> ledgerStore.getBalance(username))
                .orElseThrow(() -> new IllegalStateException("No account for user " + username));
    }

    public TransferResult submitTransfer(String token, String recipient, String amount, String reference) {
        return submitTransfer(token, recipient, amount, reference, null);
    }

    public TransferResult submitTransfer(String token, String recipient, String amount,
                                         String reference, String idempotencyKey) {
        String username = authenticate(token);
        return transferEngine.submitTransfer(username, recipient, amount, reference, idempotencyKey);
    }

    public Transfer getTransferStatus(String token, String transferId) {
        String username = authenticate(token);
        return transferEngine.getTransferStatus(username, transferId);
    }

    /**
     * Transfers the caller sent or received, newest first.
     */
    public List<Transfer> listTransfers(String token) {
        String username = authenticate(token);
        return transferEngine.listTransfers(username);
    }

    private String authenticate(String token) {
        String username = sessionManager.validate(token);
        CorrelationContext.bindUser(username);
        return username;
    }

    /**
     * Usernames longer than any stored one are cut to the column width; the
     * details keep the submitted length.
     */
    private void auditFailedLogin(String username) {
        if (username.length() <= User.MAX_USERNAME_LENGTH) {
            audit(AuditOperation.LOGIN_FAILED, username, "Invalid credentials");
            return;
        }
        audit(AuditOperation.LOGIN_FAILED, username.substring(0, User.MAX_USERNAME_LENGTH),
                "Invalid credentials, username truncated from " + username.length() + " characters");
    }

    private static String abbreviate(String username) {
        if (username == null || username.length() <= User.MAX_USERNAME_LENGTH) {
            return username;
        }
        return username.substring(0, User.MAX_USERNAME_LENGTH) + "...";
    }

    private void audit(AuditOperation operation, String username, String details) {
        storeCall("appendAudit", () -> {
            ledgerStore.appendAudit(AuditLogEntry.of(operation, username, details, clock.instant()));
            return null;
        });
    }

    private <T> T storeCall(String operation, StoreCall<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Ledger store failure during {}: {}", operation, e.getMessage());
            metrics.recordStoreFailure(operation);
            throw BankingException.storeUnavailable(operation, e);
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T get();
    }
}

package com.flagship.bank_transfer.exception;

import lombok.Getter;

/**
 * Single exception type for every failure in the {@link ErrorCode} taxonomy.
 *
 * Factory methods keep the caller-facing messages in one place; in particular
 * the credential failure message is identical for unknown users and wrong passwords.
 */
@Getter
public class BankingException extends RuntimeException {

    private final ErrorCode code;

    public BankingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BankingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static BankingException unauthorized() {
        return new BankingException(ErrorCode.UNAUTHORIZED, "Invalid or expired session token");
    }

    public static BankingException invalidCredentials() {
        return new BankingException(ErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
    }

    public static BankingException unknownRecipient(String recipient) {
        return new BankingException(ErrorCode.UNKNOWN_RECIPIENT, "Invalid recipient account: " + recipient);
    }

    public static BankingException selfTransfer() {
        return new BankingException(ErrorCode.SELF_TRANSFER_NOT_ALLOWED, "Recipient cannot be the sender");
    }

    public static BankingException invalidAmount(String message) {
        return new BankingException(ErrorCode.INVALID_AMOUNT, message);
    }

    public static BankingException invalidIdempotencyKey(int maxLength) {
        return new BankingException(ErrorCode.INVALID_IDEMPOTENCY_KEY,
                "Idempotency key must be at most " + maxLength + " characters");
    }

    public static BankingException transferNotFound(String transferId) {
        return new BankingException(ErrorCode.NOT_FOUND, "Transfer not found: " + transferId);
    }

    public static BankingException forbidden(String transferId) {
        return new BankingException(ErrorCode.FORBIDDEN, "Not a party to transfer " + transferId);
    }

    public static BankingException storeUnavailable(String operation, Throwable cause) {
        return new BankingException(ErrorCode.STORE_UNAVAILABLE,
                "Ledger store unavailable during " + operation, cause);
    }
}

package com.flagship.bank_transfer.exception;

/**
 * Failure categories reported to callers of the banking operations.
 *
 * Everything except {@link #STORE_UNAVAILABLE} is caller-correctable and is
 * never retried by the service. Insufficient funds is deliberately absent:
 * it is reported as a FAILED transfer, not as an error.
 */
public enum ErrorCode {
    /**
     * Missing, unknown or expired session token.
     */
    UNAUTHORIZED,

    /**
     * Login rejected. The message never says which of username or password was wrong.
     */
    INVALID_CREDENTIALS,

    UNKNOWN_RECIPIENT,

    SELF_TRANSFER_NOT_ALLOWED,

    /**
     * Non-positive, malformed or over-precise amount.
     */
    INVALID_AMOUNT,

    /**
     * Idempotency key longer than the store accepts.
     */
    INVALID_IDEMPOTENCY_KEY,

    /**
     * No transfer with the requested id.
     */
    NOT_FOUND,

    /**
     * The transfer exists but the caller is neither its sender nor its recipient.
     */
    FORBIDDEN,

    /**
     * Data tier unreachable or the transaction was aborted. Nothing was applied.
     */
    STORE_UNAVAILABLE
}

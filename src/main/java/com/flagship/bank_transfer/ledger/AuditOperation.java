package com.flagship.bank_transfer.ledger;

public enum AuditOperation {
    USER_CREATED,
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGOUT,
    TRANSFER_COMPLETED,
    TRANSFER_FAILED
}

package com.flagship.bank_transfer.ledger;

public enum StoreHealth {
    OK,
    DEGRADED
}

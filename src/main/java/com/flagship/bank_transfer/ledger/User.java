package com.flagship.bank_transfer.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Customer identity as exposed by the ledger store. The credential verifier
 * never leaves the store.
 */
@Value
public class User {

    /**
     * Width of the {@code username} columns.
     */
    public static final int MAX_USERNAME_LENGTH = 64;

    String username;
    String email;
    Instant createdAt;
}

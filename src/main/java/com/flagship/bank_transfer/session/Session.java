package com.flagship.bank_transfer.session;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Binding of a session token to a username. Held in memory only.
 */
@Value
public class Session {
    String username;
    Instant createdAt;

    public boolean isExpired(Instant now, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return !now.isBefore(createdAt.plus(ttl));
    }
}

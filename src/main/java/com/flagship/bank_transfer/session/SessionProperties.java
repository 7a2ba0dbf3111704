package com.flagship.bank_transfer.session;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Session lifetime settings ({@code banking.session.*}).
 *
 * A zero or missing TTL disables expiry. The purge sweep interval
 * ({@code banking.session.purge-interval-ms}) is read by the scheduler directly.
 */
@ConfigurationProperties(prefix = "banking.session")
@Getter
@Setter
public class SessionProperties {

    private Duration ttl = Duration.ofMinutes(30);
}

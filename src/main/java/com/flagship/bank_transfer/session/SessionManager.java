package com.flagship.bank_transfer.session;

import com.flagship.bank_transfer.exception.BankingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and validates opaque session tokens.
 *
 * Sessions live in a process-local map and are lost on restart, which only
 * forces users to log in again. Tokens are 128 bits from {@link SecureRandom}.
 *
 * Expiry is a fixed TTL from creation: validating a token does not extend it.
 * Expired tokens are dropped lazily on validation and by a periodic sweep.
 */
@Component
@Slf4j
public class SessionManager {

    private static final int TOKEN_BYTES = 16;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final HexFormat hex = HexFormat.of();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public SessionManager(SessionProperties properties, Clock clock) {
        this(clock, properties.getTtl());
    }

    public SessionManager(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Creates a session for an already authenticated user.
     *
     * @return the new token
     */
    public String createSession(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        String token = newToken();
        sessions.put(token, new Session(username, clock.instant()));
        log.debug("Session created: user={}, token={}...", username, prefix(token));
        return token;
    }

    /**
     * Resolves a token to its username.
     *
     * @throws BankingException {@code UNAUTHORIZED} if the token is missing, unknown or expired
     */
    public String validate(String token) {
        if (token == null || token.isBlank()) {
            throw BankingException.unauthorized();
        }
        Session session = sessions.get(token);
        if (session == null) {
            throw BankingException.unauthorized();
        }
        if (session.isExpired(clock.instant(), ttl)) {
            sessions.remove(token, session);
            log.debug("Session expired: user={}, token={}...", session.getUsername(), prefix(token));
            throw BankingException.unauthorized();
        }
        return session.getUsername();
    }

    /**
     * Removes a session. Unknown tokens are ignored.
     */
    public void invalidate(String token) {
        if (token == null) {
            return;
        }
        Session removed = sessions.remove(token);
        if (removed != null) {
            log.debug("Session invalidated: user={}, token={}...", removed.getUsername(), prefix(token));
        }
    }

    @Scheduled(fixedDelayString = "${banking.session.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().isExpired(now, ttl));
        int purged = before - sessions.size();
        if (purged > 0) {
            log.info("Purged {} expired sessions", purged);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return hex.formatHex(bytes);
    }

    private static String prefix(String token) {
        return token.length() <= 6 ? token : token.substring(0, 6);
    }
}

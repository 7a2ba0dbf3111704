package com.flagship.bank_transfer.transfer;

import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.Transfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency keys for transfer submission, scoped per sender.
 *
 * Redis is a fast path only. The {@code transfers.idempotency_key} column is
 * the source of truth, so a Redis outage just means every lookup goes to the
 * ledger store.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transfer:";

    private final LedgerStore ledgerStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(LedgerStore ledgerStore,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              @Value("${banking.idempotency.ttl:P7D}") Duration ttl) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * Finds the transfer a sender already submitted under this key.
     */
    public Optional<Transfer> findExisting(String fromUser, String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<String> cachedId = readCache(fromUser, idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<Transfer> cached = ledgerStore.getTransfer(cachedId.get());
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
        }

        Optional<Transfer> stored = ledgerStore.findTransferByIdempotencyKey(fromUser, idempotencyKey);
        stored.ifPresent(transfer -> {
            log.debug("Idempotency key found in ledger store: {}", idempotencyKey);
            remember(fromUser, idempotencyKey, transfer.getTransferId());
        });
        return stored;
    }

    /**
     * Caches a key once its transfer record exists. Best effort.
     */
    public void remember(String fromUser, String idempotencyKey, String transferId) {
        requireKey(idempotencyKey);
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(redisKey(fromUser, idempotencyKey), transferId, ttl);
            } catch (DataAccessException e) {
                log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private Optional<String> readCache(String fromUser, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(redisKey(fromUser, idempotencyKey)));
        } catch (DataAccessException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to ledger store: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private static String redisKey(String fromUser, String idempotencyKey) {
        return REDIS_KEY_PREFIX + fromUser + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}

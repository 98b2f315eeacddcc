package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps {@code Idempotency-Key} headers to the transaction they created.
 *
 * Redis is a cache in front of the {@code idempotency_key} column. Redis failures are
 * logged and the lookup falls through to the database, which stays the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transaction:";

    private final ImpactTransactionRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(ImpactTransactionRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${idempotency.redis-ttl:7d}") Duration ttl) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * @return the id of the transaction created under this key, if any
     */
    public Optional<UUID> findTransactionId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = repository.findByIdempotencyKey(idempotencyKey)
                .map(ImpactTransactionEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches a key after its transaction committed. The column written with the
     * transaction already makes the key durable.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction id cannot be null");
        }
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationFailedException("Idempotency key cannot be blank");
        }
    }
}

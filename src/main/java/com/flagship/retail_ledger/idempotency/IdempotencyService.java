package com.flagship.retail_ledger.idempotency;

import com.flagship.retail_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Idempotency key lookup with a Redis fast path and the database as source of truth.
 *
 * Keys are namespaced by scope (payment, stock adjustment) and tenant, so two tenants may use
 * the same key. The database unique constraint on {@code (tenant_id, idempotency_key)} is what
 * actually prevents a double apply; Redis only saves the lookup query.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final boolean redisEnabled;
    private final Duration ttl;

    public IdempotencyService(Optional<RedisTemplate<String, String>> redisTemplate,
                              @Value("${idempotency.redis.enabled:true}") boolean redisEnabled,
                              @Value("${idempotency.redis.ttl:7d}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.redisEnabled = redisEnabled;
        this.ttl = ttl;
    }

    /**
     * Returns the id of the row created by an earlier request with this key.
     *
     * @param databaseLookup finds the id in the owning table when Redis misses or is down
     */
    public Optional<UUID> lookup(String scope, String tenantId, String idempotencyKey,
                                 Supplier<Optional<UUID>> databaseLookup) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(scope, tenantId, idempotencyKey);

        if (useRedis()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: scope={}, key={}", scope, idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = databaseLookup.get();
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: scope={}, key={}", scope, idempotencyKey);
            cache(redisKey, id);
        });
        return stored;
    }

    /**
     * Caches the key once the surrounding transaction commits. A rolled back request leaves
     * nothing behind, so a retry with the same key runs again.
     */
    public void remember(String scope, String tenantId, String idempotencyKey, UUID resultId) {
        requireKey(idempotencyKey);
        if (resultId == null) {
            throw new IllegalArgumentException("Result id cannot be null");
        }
        String redisKey = redisKey(scope, tenantId, idempotencyKey);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(redisKey, resultId);
                }
            });
        } else {
            cache(redisKey, resultId);
        }
    }

    /**
     * Drops a cached key whose row no longer resolves.
     */
    public void forget(String scope, String tenantId, String idempotencyKey) {
        if (!useRedis()) {
            return;
        }
        try {
            redisTemplate.get().delete(redisKey(scope, tenantId, idempotencyKey));
        } catch (Exception e) {
            log.debug("Failed to evict idempotency key from Redis: {}", e.getMessage());
        }
    }

    private void cache(String redisKey, UUID resultId) {
        if (!useRedis()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, resultId.toString(), ttl);
        } catch (Exception e) {
            // database remains the source of truth
            log.warn("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private boolean useRedis() {
        return redisEnabled && redisTemplate.isPresent();
    }

    private static String redisKey(String scope, String tenantId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + scope + ":" + tenantId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be null or blank");
        }
    }
}

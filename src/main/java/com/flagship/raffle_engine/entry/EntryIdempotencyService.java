package com.flagship.raffle_engine.entry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps payment references to the entries they created.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable)
 * 2. Fall back to the unique payment_reference column (always authoritative)
 * 3. Cache database hits back into Redis
 *
 * Redis failures are logged and never fail a submission.
 */
@Service
@Slf4j
public class EntryIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "raffle-entry:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final EntryRepository entryRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public EntryIdempotencyService(EntryRepository entryRepository,
                                   Optional<StringRedisTemplate> redisTemplate) {
        this.entryRepository = entryRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the entry already created for this reference, if any
     */
    public Optional<UUID> findEntryId(String paymentReference) {
        if (paymentReference == null || paymentReference.isBlank()) {
            throw new IllegalArgumentException("Payment reference cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + paymentReference);
                if (cached != null) {
                    log.debug("Payment reference found in Redis: {}", paymentReference);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for payment reference {}, falling back to database: {}",
                        paymentReference, e.getMessage());
            }
        }

        Optional<UUID> entryId = entryRepository.findByPaymentReference(paymentReference)
                .map(EntryEntity::getId);
        entryId.ifPresent(id -> {
            log.debug("Payment reference found in database: {}", paymentReference);
            cache(paymentReference, id);
        });
        return entryId;
    }

    /**
     * Caches the mapping in Redis. The database row is already the source of truth.
     */
    public void remember(String paymentReference, UUID entryId) {
        cache(paymentReference, entryId);
    }

    private void cache(String paymentReference, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + paymentReference, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache payment reference {} in Redis: {}", paymentReference, e.getMessage());
        }
    }
}

package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import com.stakeledger.web.LedgerValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Replays the stored outcome of a stake, withdraw, claim or exit when a client
 * retries with the same idempotency key. Keys are scoped per account. Only
 * successful outcomes are remembered, so a retry after a rejection runs again.
 */
@Component
public class IdempotencyRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyRegistry.class);

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final StakeLedgerProperties properties;
    private final LedgerClock ledgerClock;

    public IdempotencyRegistry(StakeLedgerProperties properties, LedgerClock ledgerClock) {
        this.properties = properties;
        this.ledgerClock = ledgerClock;
    }

    public <T> T execute(String account, String idempotencyKey, String fingerprint, Supplier<T> operation) {
        StakeLedgerProperties.Idempotency settings = properties.getIdempotency();
        if (!settings.isEnabled() || idempotencyKey == null || idempotencyKey.isBlank()) {
            return operation.get();
        }
        String key = idempotencyKey.trim();
        if (key.length() > settings.getMaxKeyLength()) {
            throw new LedgerValidationException(
                    "invalid_idempotency_key",
                    "Idempotency-Key must be at most " + settings.getMaxKeyLength() + " characters"
            );
        }

        String scopedKey = Objects.requireNonNull(account, "account is required") + "|" + key;
        while (true) {
            Slot slot = slots.computeIfAbsent(scopedKey, ignored -> new Slot());
            synchronized (slot) {
                if (slots.get(scopedKey) != slot) {
                    // dropped by a failed attempt or a purge while we waited
                    continue;
                }
                long now = ledgerClock.now();
                if (slot.completed && !slot.isExpired(now)) {
                    if (!slot.fingerprint.equals(fingerprint)) {
                        throw LedgerValidationException.idempotencyKeyReused(
                                "Idempotency-Key " + key + " was already used for a different request"
                        );
                    }
                    log.info("Replaying stored outcome for account {} idempotency key {}", account, key);
                    @SuppressWarnings("unchecked")
                    T replay = (T) slot.outcome;
                    return replay;
                }

                T outcome;
                try {
                    outcome = operation.get();
                } catch (RuntimeException ex) {
                    if (!slot.completed) {
                        slots.remove(scopedKey, slot);
                    }
                    throw ex;
                }
                slot.completed = true;
                slot.fingerprint = fingerprint;
                slot.outcome = outcome;
                slot.expiresAt = now + settings.getTtlSeconds();
                return outcome;
            }
        }
    }

    /**
     * Drops remembered outcomes whose TTL has passed, and slots no attempt completed.
     *
     * @return number of keys removed
     */
    public int purgeExpired() {
        long now = ledgerClock.now();
        int before = slots.size();
        slots.entrySet().removeIf(entry -> {
            Slot slot = entry.getValue();
            synchronized (slot) {
                return !slot.completed || slot.isExpired(now);
            }
        });
        return Math.max(0, before - slots.size());
    }

    public int size() {
        return slots.size();
    }

    private static final class Slot {
        private boolean completed;
        private String fingerprint;
        private Object outcome;
        private long expiresAt;

        private boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}

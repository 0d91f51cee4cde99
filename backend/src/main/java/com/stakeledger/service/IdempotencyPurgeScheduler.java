package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class IdempotencyPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyPurgeScheduler.class);

    private final StakeLedgerProperties properties;
    private final IdempotencyRegistry idempotencyRegistry;

    public IdempotencyPurgeScheduler(StakeLedgerProperties properties, IdempotencyRegistry idempotencyRegistry) {
        this.properties = properties;
        this.idempotencyRegistry = idempotencyRegistry;
    }

    @Scheduled(
            fixedRateString = "${stakeledger.idempotency.purge-interval-ms:60000}",
            initialDelayString = "${stakeledger.idempotency.purge-interval-ms:60000}"
    )
    public void purgeExpiredKeys() {
        if (!properties.getIdempotency().isEnabled()) {
            return;
        }

        int removed = idempotencyRegistry.purgeExpired();
        if (removed > 0) {
            log.info("Idempotency purge tick: removed={}, remaining={}", removed, idempotencyRegistry.size());
        } else {
            log.debug("Idempotency purge tick completed with nothing to remove");
        }
    }
}

package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import com.stakeledger.repository.PoolStore;
import com.stakeledger.web.LedgerStateException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per pool. Mutations on the same pool run one at a time, pools never
 * wait on each other. The busy flag turns a nested mutation of the same pool
 * (for example from inside an asset transfer callback) into an error instead
 * of letting the reentrant lock admit it. Guards exist only for pools the
 * store knows, so lookups of unknown ids leave nothing behind.
 */
@Component
public class PoolGuardRegistry {

    private final Map<Long, PoolGuard> guards = new ConcurrentHashMap<>();
    private final StakeLedgerProperties properties;
    private final PoolStore poolStore;

    public PoolGuardRegistry(StakeLedgerProperties properties, PoolStore poolStore) {
        this.properties = properties;
        this.poolStore = poolStore;
    }

    public <T> T mutate(long poolId, Supplier<T> action) {
        PoolGuard guard = guardFor(poolId);
        acquire(poolId, guard);
        try {
            if (guard.busy) {
                throw LedgerStateException.reentrantCall(poolId);
            }
            guard.busy = true;
            try {
                return action.get();
            } finally {
                guard.busy = false;
            }
        } finally {
            guard.lock.unlock();
        }
    }

    public <T> T read(long poolId, Supplier<T> action) {
        PoolGuard guard = guardFor(poolId);
        acquire(poolId, guard);
        try {
            return action.get();
        } finally {
            guard.lock.unlock();
        }
    }

    private void acquire(long poolId, PoolGuard guard) {
        long timeoutMs = properties.getGuard().getLockTimeoutMs();
        try {
            if (!guard.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw poolBusy(poolId, "timed out after " + timeoutMs + "ms");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw poolBusy(poolId, "interrupted while waiting");
        }
    }

    int guardCount() {
        return guards.size();
    }

    private PoolGuard guardFor(long poolId) {
        PoolGuard guard = guards.get(poolId);
        if (guard != null) {
            return guard;
        }
        if (poolStore.findById(poolId).isEmpty()) {
            throw LedgerStateException.poolNotFound(poolId);
        }
        return guards.computeIfAbsent(poolId, ignored -> new PoolGuard());
    }

    private static LedgerStateException poolBusy(long poolId, String detail) {
        return new LedgerStateException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "pool_busy",
                "Pool " + poolId + " lock not acquired: " + detail
        );
    }

    private static final class PoolGuard {
        private final ReentrantLock lock = new ReentrantLock();
        // only read or written while holding lock
        private boolean busy;
    }
}

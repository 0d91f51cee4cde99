package com.stakeledger.repository;

import com.stakeledger.model.StakingPool;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryPoolStore implements PoolStore {

    private final Map<Long, StakingPool> pools = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long nextPoolId() {
        return sequence.incrementAndGet();
    }

    @Override
    public Optional<StakingPool> findById(long poolId) {
        return Optional.ofNullable(pools.get(poolId)).map(StakingPool::copy);
    }

    @Override
    public List<StakingPool> findAllOrderByPoolIdAsc() {
        return pools.values().stream()
                .sorted(Comparator.comparingLong(StakingPool::getPoolId))
                .map(StakingPool::copy)
                .toList();
    }

    @Override
    public StakingPool save(StakingPool pool) {
        Objects.requireNonNull(pool, "pool is required");
        pools.put(pool.getPoolId(), pool.copy());
        return pool;
    }
}

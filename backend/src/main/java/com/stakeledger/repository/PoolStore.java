package com.stakeledger.repository;

import com.stakeledger.model.StakingPool;

import java.util.List;
import java.util.Optional;

/**
 * Pool table keyed by pool id.
 */
public interface PoolStore {

    long nextPoolId();

    Optional<StakingPool> findById(long poolId);

    List<StakingPool> findAllOrderByPoolIdAsc();

    StakingPool save(StakingPool pool);
}

package com.stakeledger.repository;

import com.stakeledger.model.PositionKey;
import com.stakeledger.model.StakePosition;

import java.util.List;
import java.util.Optional;

/**
 * Position table keyed by (poolId, account).
 */
public interface PositionStore {

    Optional<StakePosition> findByKey(PositionKey key);

    /**
     * Reporting and reconciliation only. The accrual path never walks a pool's positions.
     */
    List<StakePosition> findByPoolId(long poolId);

    StakePosition save(StakePosition position);
}

package com.stakeledger.model;

import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.time.OffsetDateTime;

/**
 * Global accrual state of one staking pool.
 * rewardPerTokenStored is scaled by {@link com.stakeledger.service.RewardMath#PRECISION}.
 */
@Getter
@Setter
public class StakingPool {

    private long poolId;

    private String stakingAsset;

    private String rewardAsset;

    /**
     * Reward units issued per second, shared by all stakers.
     */
    private BigInteger rewardRate = BigInteger.ZERO;

    /**
     * Epoch second of the last checkpoint.
     */
    private long lastUpdateTime;

    private BigInteger rewardPerTokenStored = BigInteger.ZERO;

    private BigInteger totalStaked = BigInteger.ZERO;

    /**
     * Seconds a position must stay staked before it may withdraw.
     */
    private long lockupPeriod;

    private BigInteger minStakeAmount = BigInteger.ONE;

    private boolean active = true;

    private String custodyAccount;

    private String rewardReserveAccount;

    private BigInteger totalRewardsAccrued = BigInteger.ZERO;

    private BigInteger totalRewardsPaid = BigInteger.ZERO;

    private String createdBy;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    public StakingPool copy() {
        StakingPool copy = new StakingPool();
        copy.setPoolId(poolId);
        copy.setStakingAsset(stakingAsset);
        copy.setRewardAsset(rewardAsset);
        copy.setRewardRate(rewardRate);
        copy.setLastUpdateTime(lastUpdateTime);
        copy.setRewardPerTokenStored(rewardPerTokenStored);
        copy.setTotalStaked(totalStaked);
        copy.setLockupPeriod(lockupPeriod);
        copy.setMinStakeAmount(minStakeAmount);
        copy.setActive(active);
        copy.setCustodyAccount(custodyAccount);
        copy.setRewardReserveAccount(rewardReserveAccount);
        copy.setTotalRewardsAccrued(totalRewardsAccrued);
        copy.setTotalRewardsPaid(totalRewardsPaid);
        copy.setCreatedBy(createdBy);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}

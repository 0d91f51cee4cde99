package com.stakeledger.model;

import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.time.OffsetDateTime;

@Getter
@Setter
public class StakePosition {

    private long poolId;

    private String account;

    private BigInteger amount = BigInteger.ZERO;

    /**
     * Epoch second the lockup clock started for this position.
     */
    private long stakingTime;

    private BigInteger rewardPerTokenPaid = BigInteger.ZERO;

    private BigInteger pendingRewards = BigInteger.ZERO;

    private boolean active;

    private StakePositionStatus status = StakePositionStatus.UNSTAKED;

    private BigInteger totalClaimed = BigInteger.ZERO;

    private Long lastClaimTime;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    public static StakePosition unstaked(long poolId, String account) {
        StakePosition position = new StakePosition();
        position.setPoolId(poolId);
        position.setAccount(account);
        return position;
    }

    public PositionKey key() {
        return new PositionKey(poolId, account);
    }

    public StakePosition copy() {
        StakePosition copy = new StakePosition();
        copy.setPoolId(poolId);
        copy.setAccount(account);
        copy.setAmount(amount);
        copy.setStakingTime(stakingTime);
        copy.setRewardPerTokenPaid(rewardPerTokenPaid);
        copy.setPendingRewards(pendingRewards);
        copy.setActive(active);
        copy.setStatus(status);
        copy.setTotalClaimed(totalClaimed);
        copy.setLastClaimTime(lastClaimTime);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}

package com.stakeledger.controller.dto;

import java.math.BigInteger;
import java.time.OffsetDateTime;

public final class LedgerResponses {

    private LedgerResponses() {
    }

    public record PoolDetail(
            long poolId,
            String stakingAsset,
            String rewardAsset,
            BigInteger rewardRate,
            long lastUpdateTime,
            BigInteger rewardPerTokenStored,
            BigInteger totalStaked,
            long lockupPeriod,
            BigInteger minStakeAmount,
            boolean active,
            String custodyAccount,
            String rewardReserveAccount,
            BigInteger rewardReserveBalance,
            BigInteger totalRewardsAccrued,
            BigInteger totalRewardsPaid,
            String createdBy,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record StakeDetail(
            long poolId,
            String account,
            BigInteger amount,
            long stakingTime,
            long unlockTime,
            BigInteger rewardPerTokenPaid,
            BigInteger pendingRewards,
            BigInteger earned,
            boolean active,
            String status,
            BigInteger totalClaimed,
            Long lastClaimTime
    ) {
    }

    public record RewardClaimResponse(
            long poolId,
            String account,
            BigInteger amountPaid,
            long claimedAt
    ) {
    }

    public record ExitResponse(
            long poolId,
            String account,
            BigInteger amountWithdrawn,
            BigInteger rewardsPaid,
            StakeDetail position
    ) {
    }

    public record EarnedResponse(
            long poolId,
            String account,
            BigInteger earned
    ) {
    }

    public record RewardPerTokenResponse(
            long poolId,
            BigInteger rewardPerToken,
            BigInteger precision
    ) {
    }
}

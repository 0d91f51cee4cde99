package com.stakeledger.mapper;

import com.stakeledger.controller.dto.LedgerResponses;
import com.stakeledger.model.ExitResult;
import com.stakeledger.model.RewardClaim;
import com.stakeledger.model.StakeInfo;
import com.stakeledger.model.StakingPool;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class LedgerResponseMapper {

    public LedgerResponses.PoolDetail toPoolDetailResponse(StakingPool pool, BigInteger rewardReserveBalance) {
        return new LedgerResponses.PoolDetail(
                pool.getPoolId(),
                pool.getStakingAsset(),
                pool.getRewardAsset(),
                pool.getRewardRate(),
                pool.getLastUpdateTime(),
                pool.getRewardPerTokenStored(),
                pool.getTotalStaked(),
                pool.getLockupPeriod(),
                pool.getMinStakeAmount(),
                pool.isActive(),
                pool.getCustodyAccount(),
                pool.getRewardReserveAccount(),
                rewardReserveBalance,
                pool.getTotalRewardsAccrued(),
                pool.getTotalRewardsPaid(),
                pool.getCreatedBy(),
                pool.getCreatedAt(),
                pool.getUpdatedAt()
        );
    }

    public LedgerResponses.StakeDetail toStakeDetailResponse(StakeInfo info) {
        return new LedgerResponses.StakeDetail(
                info.poolId(),
                info.account(),
                info.amount(),
                info.stakingTime(),
                info.unlockTime(),
                info.rewardPerTokenPaid(),
                info.pendingRewards(),
                info.earned(),
                info.active(),
                info.status() != null ? info.status().name() : null,
                info.totalClaimed(),
                info.lastClaimTime()
        );
    }

    public LedgerResponses.RewardClaimResponse toRewardClaimResponse(RewardClaim claim) {
        return new LedgerResponses.RewardClaimResponse(
                claim.poolId(),
                claim.account(),
                claim.amountPaid(),
                claim.claimedAt()
        );
    }

    public LedgerResponses.ExitResponse toExitResponse(ExitResult result) {
        return new LedgerResponses.ExitResponse(
                result.poolId(),
                result.account(),
                result.amountWithdrawn(),
                result.rewardsPaid(),
                toStakeDetailResponse(result.position())
        );
    }
}

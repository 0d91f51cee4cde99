package com.stakeledger.model;

import java.math.BigInteger;

/**
 * Read view of a position, with rewards accrued up to the time it was taken.
 * Accounts that never staked get an UNSTAKED view with zero balances.
 */
public record StakeInfo(
        long poolId,
        String account,
        BigInteger amount,
        long stakingTime,
        long unlockTime,
        BigInteger rewardPerTokenPaid,
        BigInteger pendingRewards,
        BigInteger earned,
        boolean active,
        StakePositionStatus status,
        BigInteger totalClaimed,
        Long lastClaimTime
) {
}

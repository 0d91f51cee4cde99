package com.stakeledger.model;

import java.math.BigInteger;

public record ExitResult(
        long poolId,
        String account,
        BigInteger amountWithdrawn,
        BigInteger rewardsPaid,
        StakeInfo position
) {
}

package com.stakeledger.model;

import java.math.BigInteger;

public record RewardClaim(
        long poolId,
        String account,
        BigInteger amountPaid,
        long claimedAt
) {

    public boolean paidOut() {
        return amountPaid.signum() > 0;
    }
}

package com.stakeledger.service;

import com.stakeledger.model.StakePosition;
import com.stakeledger.model.StakingPool;
import com.stakeledger.web.LedgerArithmeticException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RewardMathTest {

    @Test
    void rewardPerTokenIsFrozenWhileNothingIsStaked() {
        StakingPool pool = pool(100, 1_000, 0);
        pool.setRewardPerTokenStored(BigInteger.valueOf(42));

        assertEquals(BigInteger.valueOf(42), RewardMath.rewardPerToken(pool, 5_000));
        assertEquals(BigInteger.ZERO, RewardMath.emittedSince(pool, 5_000));
    }

    @Test
    void rewardPerTokenAddsScaledEmissionPerStakedUnit() {
        StakingPool pool = pool(100, 1_000, 100);

        assertEquals(RewardMath.PRECISION.multiply(BigInteger.TEN), RewardMath.rewardPerToken(pool, 1_010));
        assertEquals(BigInteger.valueOf(1_000), RewardMath.emittedSince(pool, 1_010));
    }

    @Test
    void rewardPerTokenFloorsTheDivision() {
        StakingPool pool = pool(1, 0, 3);

        // 1 * 10^18 / 3 leaves a remainder of 1
        assertEquals(new BigInteger("333333333333333333"), RewardMath.rewardPerToken(pool, 1));
    }

    @Test
    void clockBehindLastUpdateAccruesNothing() {
        StakingPool pool = pool(100, 1_000, 100);

        assertEquals(BigInteger.ZERO, RewardMath.rewardPerToken(pool, 900));
    }

    @Test
    void earnedAddsBankedRewardsToNewAccrual() {
        StakePosition position = StakePosition.unstaked(1, "alice");
        position.setAmount(BigInteger.valueOf(3));
        position.setRewardPerTokenPaid(new BigInteger("333333333333333333"));
        position.setPendingRewards(BigInteger.valueOf(7));

        BigInteger rewardPerToken = new BigInteger("999999999999999999");

        // 3 * 666666666666666666 / 10^18 floors to 1
        assertEquals(BigInteger.valueOf(8), RewardMath.earned(position, rewardPerToken));
    }

    @Test
    void overflowAndUnderflowAreRejected() {
        assertThrows(LedgerArithmeticException.class,
                () -> RewardMath.add(RewardMath.MAX_UINT256, BigInteger.ONE, "total"));
        assertThrows(LedgerArithmeticException.class,
                () -> RewardMath.subtract(BigInteger.ONE, BigInteger.TWO, "total"));
        assertThrows(LedgerArithmeticException.class,
                () -> RewardMath.multiply(RewardMath.MAX_UINT256, BigInteger.TWO, "total"));
        assertEquals(RewardMath.MAX_UINT256, RewardMath.checked(RewardMath.MAX_UINT256, "total"));
    }

    private static StakingPool pool(long rate, long lastUpdateTime, long totalStaked) {
        StakingPool pool = new StakingPool();
        pool.setRewardRate(BigInteger.valueOf(rate));
        pool.setLastUpdateTime(lastUpdateTime);
        pool.setTotalStaked(BigInteger.valueOf(totalStaked));
        return pool;
    }
}

package com.stakeledger.service;

import com.stakeledger.model.StakePosition;
import com.stakeledger.model.StakingPool;
import com.stakeledger.web.LedgerArithmeticException;

import java.math.BigInteger;

/**
 * Fixed-point reward-per-token arithmetic.
 *
 * All values live in the unsigned 256-bit range. Division floors, so rounding
 * can only leave dust in the pool, never pay out more than was emitted.
 *
 * rewardPerToken = stored + elapsed * rate * PRECISION / totalStaked (stored when nothing is staked)
 * earned         = amount * (rewardPerToken - paid) / PRECISION + pending
 */
public final class RewardMath {

    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private RewardMath() {
    }

    public static BigInteger rewardPerToken(StakingPool pool, long now) {
        BigInteger stored = pool.getRewardPerTokenStored();
        if (pool.getTotalStaked().signum() == 0) {
            return stored;
        }
        BigInteger elapsed = BigInteger.valueOf(elapsedSeconds(pool, now));
        BigInteger scaledEmission = multiply(
                multiply(elapsed, pool.getRewardRate(), "reward emission"),
                PRECISION,
                "scaled reward emission"
        );
        return add(stored, scaledEmission.divide(pool.getTotalStaked()), "reward per token");
    }

    public static BigInteger earned(StakePosition position, BigInteger rewardPerToken) {
        BigInteger delta = subtract(rewardPerToken, position.getRewardPerTokenPaid(), "reward per token delta");
        BigInteger accrued = multiply(position.getAmount(), delta, "position accrual").divide(PRECISION);
        return add(accrued, position.getPendingRewards(), "earned rewards");
    }

    /**
     * Reward emitted to stakers between the pool's last checkpoint and {@code now}.
     */
    public static BigInteger emittedSince(StakingPool pool, long now) {
        if (pool.getTotalStaked().signum() == 0) {
            return BigInteger.ZERO;
        }
        return multiply(BigInteger.valueOf(elapsedSeconds(pool, now)), pool.getRewardRate(), "reward emission");
    }

    public static BigInteger add(BigInteger left, BigInteger right, String quantity) {
        return checked(left.add(right), quantity);
    }

    public static BigInteger subtract(BigInteger left, BigInteger right, String quantity) {
        return checked(left.subtract(right), quantity);
    }

    public static BigInteger multiply(BigInteger left, BigInteger right, String quantity) {
        return checked(left.multiply(right), quantity);
    }

    public static BigInteger checked(BigInteger value, String quantity) {
        if (value.signum() < 0) {
            throw new LedgerArithmeticException(quantity + " underflowed below zero");
        }
        if (value.compareTo(MAX_UINT256) > 0) {
            throw new LedgerArithmeticException(quantity + " exceeds the unsigned 256-bit range");
        }
        return value;
    }

    private static long elapsedSeconds(StakingPool pool, long now) {
        return Math.max(0L, now - pool.getLastUpdateTime());
    }
}

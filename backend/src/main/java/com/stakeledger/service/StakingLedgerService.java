package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import com.stakeledger.model.ExitResult;
import com.stakeledger.model.LedgerAction;
import com.stakeledger.model.LockupTopUpPolicy;
import com.stakeledger.model.PositionKey;
import com.stakeledger.model.RewardClaim;
import com.stakeledger.model.StakeInfo;
import com.stakeledger.model.StakePosition;
import com.stakeledger.model.StakePositionStatus;
import com.stakeledger.model.StakingPool;
import com.stakeledger.repository.PoolStore;
import com.stakeledger.repository.PositionStore;
import com.stakeledger.web.LedgerAuthorizationException;
import com.stakeledger.web.LedgerStateException;
import com.stakeledger.web.LedgerValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Time-weighted staking reward ledger.
 *
 * Every mutation checkpoints the pool (and the caller's position) with the
 * staking distribution that held until now, and only then changes amounts,
 * totals or the reward rate. Work per call is constant: no call reads any
 * position other than the caller's.
 *
 * Mutations run on copies of the stored pool and position. The copies are
 * written back only after the asset transfer succeeded, so a rejected call
 * leaves the stores as they were.
 */
@Service
public class StakingLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StakingLedgerService.class);

    private final PoolStore poolStore;
    private final PositionStore positionStore;
    private final AssetLedger assetLedger;
    private final AccessControl accessControl;
    private final LedgerClock ledgerClock;
    private final PoolGuardRegistry poolGuardRegistry;
    private final StakeLedgerProperties properties;

    public StakingLedgerService(
            PoolStore poolStore,
            PositionStore positionStore,
            AssetLedger assetLedger,
            AccessControl accessControl,
            LedgerClock ledgerClock,
            PoolGuardRegistry poolGuardRegistry,
            StakeLedgerProperties properties
    ) {
        this.poolStore = poolStore;
        this.positionStore = positionStore;
        this.assetLedger = assetLedger;
        this.accessControl = accessControl;
        this.ledgerClock = ledgerClock;
        this.poolGuardRegistry = poolGuardRegistry;
        this.properties = properties;
    }

    public StakingPool createPool(
            String caller,
            String stakingAsset,
            String rewardAsset,
            BigInteger rewardRate,
            long lockupPeriod,
            BigInteger minStake
    ) {
        authorize(caller, LedgerAction.CREATE_POOL);
        if (isBlank(stakingAsset) || isBlank(rewardAsset)) {
            throw LedgerValidationException.invalidPoolParameters("stakingAsset and rewardAsset are required");
        }
        if (rewardRate == null || rewardRate.signum() <= 0) {
            throw LedgerValidationException.invalidPoolParameters("rewardRate must be positive");
        }
        if (minStake == null || minStake.signum() <= 0) {
            throw LedgerValidationException.invalidPoolParameters("minStake must be positive");
        }
        if (lockupPeriod < 0) {
            throw LedgerValidationException.invalidPoolParameters("lockupPeriod must not be negative");
        }
        RewardMath.checked(rewardRate, "reward rate");
        RewardMath.checked(minStake, "minimum stake");

        long now = ledgerClock.now();
        long poolId = poolStore.nextPoolId();

        StakingPool pool = new StakingPool();
        pool.setPoolId(poolId);
        pool.setStakingAsset(stakingAsset.trim());
        pool.setRewardAsset(rewardAsset.trim());
        pool.setRewardRate(rewardRate);
        pool.setLastUpdateTime(now);
        pool.setRewardPerTokenStored(BigInteger.ZERO);
        pool.setTotalStaked(BigInteger.ZERO);
        pool.setLockupPeriod(lockupPeriod);
        pool.setMinStakeAmount(minStake);
        pool.setActive(true);
        pool.setCustodyAccount("pool:" + poolId + ":stake");
        pool.setRewardReserveAccount("pool:" + poolId + ":rewards");
        pool.setCreatedBy(caller.trim());
        pool.setCreatedAt(toDateTime(now));
        pool.setUpdatedAt(toDateTime(now));

        poolStore.save(pool);
        log.info("Created staking pool {}: stakingAsset={}, rewardAsset={}, rewardRate={}, lockupPeriod={}s, minStake={}",
                poolId, pool.getStakingAsset(), pool.getRewardAsset(), rewardRate, lockupPeriod, minStake);
        return pool;
    }

    public StakeInfo stake(long poolId, String account, BigInteger amount) {
        String owner = requireAccount(account);
        requirePositive(amount, "stake amount");

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            if (!pool.isActive()) {
                throw LedgerStateException.poolInactive(poolId);
            }
            if (amount.compareTo(pool.getMinStakeAmount()) < 0) {
                throw LedgerValidationException.belowMinimumStake(
                        "Stake " + amount + " is below the pool minimum " + pool.getMinStakeAmount()
                );
            }

            long now = ledgerClock.now();
            StakePosition position = positionStore.findByKey(new PositionKey(poolId, owner))
                    .orElseGet(() -> StakePosition.unstaked(poolId, owner));
            checkpoint(pool, position, now);

            StakePositionStatus previousStatus = position.getStatus();
            position.setAmount(RewardMath.add(position.getAmount(), amount, "position amount"));
            pool.setTotalStaked(RewardMath.add(pool.getTotalStaked(), amount, "pool total staked"));
            if (previousStatus != StakePositionStatus.ACTIVE
                    || properties.getLockup().getTopUpPolicy() == LockupTopUpPolicy.RESTART) {
                position.setStakingTime(now);
            }
            position.setActive(true);
            position.setStatus(StakePositionStatus.ACTIVE);
            if (position.getCreatedAt() == null) {
                position.setCreatedAt(toDateTime(now));
            }

            transferOrReject(pool.getStakingAsset(), owner, pool.getCustodyAccount(), amount, "stake");
            commit(pool, position, now);

            log.info("Staked {} into pool {} for {}: transition={}->ACTIVE, positionAmount={}, totalStaked={}",
                    amount, poolId, owner, previousStatus, position.getAmount(), pool.getTotalStaked());
            return toStakeInfo(pool, position, position.getPendingRewards());
        });
    }

    public StakeInfo withdraw(long poolId, String account, BigInteger amount) {
        String owner = requireAccount(account);
        requirePositive(amount, "withdraw amount");

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            StakePosition position = loadActivePosition(poolId, owner);
            if (amount.compareTo(position.getAmount()) > 0) {
                throw LedgerStateException.insufficientStake(
                        "Withdraw " + amount + " exceeds staked balance " + position.getAmount()
                );
            }
            requireLockupElapsed(pool, position, now);

            checkpoint(pool, position, now);
            position.setAmount(RewardMath.subtract(position.getAmount(), amount, "position amount"));
            pool.setTotalStaked(RewardMath.subtract(pool.getTotalStaked(), amount, "pool total staked"));
            if (position.getAmount().signum() == 0) {
                position.setActive(false);
                position.setStatus(StakePositionStatus.FULLY_WITHDRAWN);
            }

            transferOrReject(pool.getStakingAsset(), pool.getCustodyAccount(), owner, amount, "withdraw");
            commit(pool, position, now);

            log.info("Withdrew {} from pool {} for {}: status={}, positionAmount={}, totalStaked={}",
                    amount, poolId, owner, position.getStatus(), position.getAmount(), pool.getTotalStaked());
            return toStakeInfo(pool, position, position.getPendingRewards());
        });
    }

    public RewardClaim claimReward(long poolId, String account) {
        String owner = requireAccount(account);

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            StakePosition position = positionStore.findByKey(new PositionKey(poolId, owner)).orElse(null);
            if (position == null) {
                log.debug("Claim on pool {} by {} with no position, nothing to pay", poolId, owner);
                return new RewardClaim(poolId, owner, BigInteger.ZERO, now);
            }

            checkpoint(pool, position, now);
            BigInteger reward = position.getPendingRewards();
            if (reward.signum() > 0) {
                transferOrReject(pool.getRewardAsset(), pool.getRewardReserveAccount(), owner, reward, "reward claim");
                recordPayout(pool, position, reward, now);
            }
            commit(pool, position, now);

            if (reward.signum() > 0) {
                log.info("Paid {} {} rewards from pool {} to {}", reward, pool.getRewardAsset(), poolId, owner);
            } else {
                log.debug("Claim on pool {} by {} had no pending rewards", poolId, owner);
            }
            return new RewardClaim(poolId, owner, reward, now);
        });
    }

    /**
     * Withdraws the whole position and pays its rewards as one operation.
     */
    public ExitResult exit(long poolId, String account) {
        String owner = requireAccount(account);

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            StakePosition position = loadActivePosition(poolId, owner);
            requireLockupElapsed(pool, position, now);

            checkpoint(pool, position, now);
            BigInteger principal = position.getAmount();
            BigInteger reward = position.getPendingRewards();
            BigInteger reserve = assetLedger.balanceOf(pool.getRewardAsset(), pool.getRewardReserveAccount());
            if (reward.compareTo(reserve) > 0) {
                throw LedgerStateException.transferFailed(
                        "Reward reserve of pool " + poolId + " holds " + reserve + ", exit needs " + reward
                );
            }

            position.setAmount(BigInteger.ZERO);
            position.setActive(false);
            position.setStatus(StakePositionStatus.FULLY_WITHDRAWN);
            pool.setTotalStaked(RewardMath.subtract(pool.getTotalStaked(), principal, "pool total staked"));

            transferOrReject(pool.getStakingAsset(), pool.getCustodyAccount(), owner, principal, "exit withdraw");
            if (reward.signum() > 0) {
                TransferResult payout = assetLedger.transfer(
                        pool.getRewardAsset(), pool.getRewardReserveAccount(), owner, reward
                );
                if (!payout.success()) {
                    if (!reversePrincipal(pool, owner, principal)) {
                        // principal already left custody; keep the books matching it
                        commit(pool, position, now);
                        throw LedgerStateException.transferFailed(
                                "exit reward payout failed: " + payout.failureReason() + "; principal " + principal
                                        + " was returned and " + reward + " rewards remain claimable"
                        );
                    }
                    throw LedgerStateException.transferFailed("exit reward payout failed: " + payout.failureReason());
                }
                recordPayout(pool, position, reward, now);
            }
            commit(pool, position, now);

            log.info("Exited pool {} for {}: withdrew={}, rewardsPaid={}, totalStaked={}",
                    poolId, owner, principal, reward, pool.getTotalStaked());
            return new ExitResult(poolId, owner, principal, reward,
                    toStakeInfo(pool, position, position.getPendingRewards()));
        });
    }

    public StakingPool setRewardRate(String caller, long poolId, BigInteger newRate) {
        authorize(caller, LedgerAction.SET_REWARD_RATE);
        if (newRate == null || newRate.signum() < 0) {
            throw LedgerValidationException.invalidPoolParameters("rewardRate must not be negative");
        }
        RewardMath.checked(newRate, "reward rate");

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            checkpoint(pool, null, now);
            BigInteger previousRate = pool.getRewardRate();
            pool.setRewardRate(newRate);
            commit(pool, null, now);

            log.info("Reward rate of pool {} changed by {}: {} -> {} at {}",
                    poolId, caller, previousRate, newRate, now);
            return pool;
        });
    }

    public StakingPool setPoolActive(String caller, long poolId, boolean active) {
        authorize(caller, LedgerAction.SET_POOL_STATUS);

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            checkpoint(pool, null, now);
            boolean previous = pool.isActive();
            pool.setActive(active);
            commit(pool, null, now);

            if (previous != active) {
                log.info("Pool {} {} by {}", poolId, active ? "activated" : "deactivated", caller);
            }
            return pool;
        });
    }

    /**
     * Moves reward asset from {@code funder} into the pool's reward reserve.
     */
    public StakingPool fundRewards(long poolId, String funder, BigInteger amount) {
        String source = requireAccount(funder);
        requirePositive(amount, "funding amount");

        return poolGuardRegistry.mutate(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            long now = ledgerClock.now();
            transferOrReject(pool.getRewardAsset(), source, pool.getRewardReserveAccount(), amount, "reward funding");
            pool.setUpdatedAt(toDateTime(now));
            poolStore.save(pool);

            log.info("Funded pool {} reward reserve with {} {} from {}", poolId, amount, pool.getRewardAsset(), source);
            return pool;
        });
    }

    public BigInteger earned(long poolId, String account) {
        String owner = requireAccount(account);
        return poolGuardRegistry.read(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            return positionStore.findByKey(new PositionKey(poolId, owner))
                    .map(position -> RewardMath.earned(position, RewardMath.rewardPerToken(pool, ledgerClock.now())))
                    .orElse(BigInteger.ZERO);
        });
    }

    public BigInteger rewardPerToken(long poolId) {
        return poolGuardRegistry.read(poolId, () -> RewardMath.rewardPerToken(loadPool(poolId), ledgerClock.now()));
    }

    public StakeInfo getStakeInfo(long poolId, String account) {
        String owner = requireAccount(account);
        return poolGuardRegistry.read(poolId, () -> {
            StakingPool pool = loadPool(poolId);
            StakePosition position = positionStore.findByKey(new PositionKey(poolId, owner))
                    .orElseGet(() -> StakePosition.unstaked(poolId, owner));
            BigInteger earned = RewardMath.earned(position, RewardMath.rewardPerToken(pool, ledgerClock.now()));
            return toStakeInfo(pool, position, earned);
        });
    }

    public StakingPool getPool(long poolId) {
        return poolGuardRegistry.read(poolId, () -> loadPool(poolId));
    }

    public List<StakingPool> listPools() {
        return poolStore.findAllOrderByPoolIdAsc();
    }

    public BigInteger rewardReserveBalance(StakingPool pool) {
        return assetLedger.balanceOf(pool.getRewardAsset(), pool.getRewardReserveAccount());
    }

    private void checkpoint(StakingPool pool, StakePosition position, long now) {
        BigInteger rewardPerToken = RewardMath.rewardPerToken(pool, now);
        BigInteger emitted = RewardMath.emittedSince(pool, now);

        pool.setRewardPerTokenStored(rewardPerToken);
        pool.setTotalRewardsAccrued(RewardMath.add(pool.getTotalRewardsAccrued(), emitted, "total rewards accrued"));
        pool.setLastUpdateTime(Math.max(pool.getLastUpdateTime(), now));

        if (position != null) {
            position.setPendingRewards(RewardMath.earned(position, rewardPerToken));
            position.setRewardPerTokenPaid(rewardPerToken);
        }
    }

    private void commit(StakingPool pool, StakePosition position, long now) {
        OffsetDateTime timestamp = toDateTime(now);
        pool.setUpdatedAt(timestamp);
        poolStore.save(pool);
        if (position != null) {
            position.setUpdatedAt(timestamp);
            positionStore.save(position);
        }
    }

    private void recordPayout(StakingPool pool, StakePosition position, BigInteger reward, long now) {
        position.setPendingRewards(BigInteger.ZERO);
        position.setTotalClaimed(RewardMath.add(position.getTotalClaimed(), reward, "position total claimed"));
        position.setLastClaimTime(now);
        pool.setTotalRewardsPaid(RewardMath.add(pool.getTotalRewardsPaid(), reward, "pool total rewards paid"));
    }

    private boolean reversePrincipal(StakingPool pool, String owner, BigInteger principal) {
        TransferResult reversal = assetLedger.transfer(
                pool.getStakingAsset(), owner, pool.getCustodyAccount(), principal
        );
        if (!reversal.success()) {
            log.error("Could not return {} {} from {} to custody of pool {} after a failed exit payout, "
                            + "recording the withdrawal with rewards left pending: {}",
                    principal, pool.getStakingAsset(), owner, pool.getPoolId(), reversal.failureReason());
            return false;
        }
        return true;
    }

    private StakingPool loadPool(long poolId) {
        return poolStore.findById(poolId)
                .orElseThrow(() -> LedgerStateException.poolNotFound(poolId));
    }

    private StakePosition loadActivePosition(long poolId, String owner) {
        StakePosition position = positionStore.findByKey(new PositionKey(poolId, owner))
                .orElseThrow(() -> LedgerStateException.positionInactive(
                        "No stake in pool " + poolId + " for " + owner
                ));
        if (position.getStatus() != StakePositionStatus.ACTIVE) {
            throw LedgerStateException.positionInactive(
                    "Position of " + owner + " in pool " + poolId + " is " + position.getStatus()
            );
        }
        return position;
    }

    private void requireLockupElapsed(StakingPool pool, StakePosition position, long now) {
        long unlockTime = unlockTime(pool, position);
        if (now < unlockTime) {
            throw LedgerStateException.lockupNotElapsed(
                    "Position of " + position.getAccount() + " in pool " + pool.getPoolId()
                            + " is locked until " + unlockTime + " (now " + now + ")"
            );
        }
    }

    private void transferOrReject(String asset, String from, String to, BigInteger amount, String purpose) {
        TransferResult result = assetLedger.transfer(asset, from, to, amount);
        if (!result.success()) {
            log.warn("{} transfer of {} {} from {} to {} failed: {}", purpose, amount, asset, from, to,
                    result.failureReason());
            throw LedgerStateException.transferFailed(purpose + " transfer failed: " + result.failureReason());
        }
    }

    private void authorize(String caller, LedgerAction action) {
        if (!accessControl.hasRole(caller, action.requiredRole())) {
            log.warn("Rejected {} by {}: missing role {}", action, caller, action.requiredRole());
            throw new LedgerAuthorizationException(
                    "Caller " + caller + " lacks role " + action.requiredRole() + " for " + action
            );
        }
    }

    private StakeInfo toStakeInfo(StakingPool pool, StakePosition position, BigInteger earned) {
        boolean staked = position.getStatus() == StakePositionStatus.ACTIVE;
        return new StakeInfo(
                position.getPoolId(),
                position.getAccount(),
                position.getAmount(),
                position.getStakingTime(),
                staked ? unlockTime(pool, position) : 0L,
                position.getRewardPerTokenPaid(),
                position.getPendingRewards(),
                earned,
                position.isActive(),
                position.getStatus(),
                position.getTotalClaimed(),
                position.getLastClaimTime()
        );
    }

    private static long unlockTime(StakingPool pool, StakePosition position) {
        long stakingTime = position.getStakingTime();
        long lockup = pool.getLockupPeriod();
        return stakingTime > Long.MAX_VALUE - lockup ? Long.MAX_VALUE : stakingTime + lockup;
    }

    private static String requireAccount(String account) {
        if (isBlank(account)) {
            throw new LedgerValidationException("invalid_account", "account is required");
        }
        return account.trim();
    }

    private static void requirePositive(BigInteger amount, String label) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerValidationException.invalidAmount(label + " must be positive");
        }
        RewardMath.checked(amount, label);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static OffsetDateTime toDateTime(long epochSecond) {
        return OffsetDateTime.ofInstant(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
    }
}

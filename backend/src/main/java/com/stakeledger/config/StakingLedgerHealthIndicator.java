package com.stakeledger.config;

import com.stakeledger.model.StakingPool;
import com.stakeledger.repository.PoolStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

@Component("stakingLedger")
public class StakingLedgerHealthIndicator implements HealthIndicator {

    private final PoolStore poolStore;

    public StakingLedgerHealthIndicator(PoolStore poolStore) {
        this.poolStore = poolStore;
    }

    @Override
    public Health health() {
        try {
            List<StakingPool> pools = poolStore.findAllOrderByPoolIdAsc();
            long activePools = pools.stream().filter(StakingPool::isActive).count();
            return Health.up()
                    .withDetail("pools", pools.size())
                    .withDetail("activePools", activePools)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}

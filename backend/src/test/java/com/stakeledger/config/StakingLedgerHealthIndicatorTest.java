package com.stakeledger.config;

import com.stakeledger.model.StakingPool;
import com.stakeledger.repository.PoolStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StakingLedgerHealthIndicatorTest {

    @Mock
    private PoolStore poolStore;

    @InjectMocks
    private StakingLedgerHealthIndicator healthIndicator;

    @Test
    void reportsPoolCounts() {
        when(poolStore.findAllOrderByPoolIdAsc()).thenReturn(List.of(pool(1, true), pool(2, false), pool(3, true)));

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(3, health.getDetails().get("pools"));
        assertEquals(2L, health.getDetails().get("activePools"));
    }

    @Test
    void reportsDownWhenStoreFails() {
        when(poolStore.findAllOrderByPoolIdAsc()).thenThrow(new IllegalStateException("store unavailable"));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
    }

    private static StakingPool pool(long poolId, boolean active) {
        StakingPool pool = new StakingPool();
        pool.setPoolId(poolId);
        pool.setActive(active);
        return pool;
    }
}

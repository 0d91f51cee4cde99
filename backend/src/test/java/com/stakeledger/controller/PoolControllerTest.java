package com.stakeledger.controller;

import com.stakeledger.mapper.LedgerResponseMapper;
import com.stakeledger.model.StakingPool;
import com.stakeledger.service.StakingLedgerService;
import com.stakeledger.web.LedgerAuthorizationException;
import com.stakeledger.web.LedgerStateException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PoolController.class)
@Import(LedgerResponseMapper.class)
class PoolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StakingLedgerService stakingLedgerService;

    @Test
    void createPoolReturnsCreatedPayload() throws Exception {
        when(stakingLedgerService.createPool(
                eq("admin"), eq("STK"), eq("RWD"), eq(BigInteger.valueOf(100)), eq(3600L), eq(BigInteger.TEN)))
                .thenReturn(samplePool(1L, true));
        when(stakingLedgerService.rewardReserveBalance(any())).thenReturn(BigInteger.valueOf(5000));

        mockMvc.perform(post("/api/pools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "caller": "admin",
                                  "stakingAsset": "STK",
                                  "rewardAsset": "RWD",
                                  "rewardRate": 100,
                                  "lockupPeriod": 3600,
                                  "minStake": 10
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.poolId").value(1))
                .andExpect(jsonPath("$.rewardRate").value(100))
                .andExpect(jsonPath("$.custodyAccount").value("pool:1:stake"))
                .andExpect(jsonPath("$.rewardReserveBalance").value(5000))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void createPoolValidationFailureReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/pools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "caller": "admin",
                                  "stakingAsset": "",
                                  "rewardAsset": "RWD",
                                  "rewardRate": 0,
                                  "lockupPeriod": -1,
                                  "minStake": 10
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.stakingAsset").value("stakingAsset is required"))
                .andExpect(jsonPath("$.fieldErrors.rewardRate").value("rewardRate must be positive"))
                .andExpect(jsonPath("$.fieldErrors.lockupPeriod").value("lockupPeriod must not be negative"));

        verify(stakingLedgerService, never())
                .createPool(anyString(), anyString(), anyString(), any(), anyLong(), any());
    }

    @Test
    void createPoolWithoutRoleReturnsForbidden() throws Exception {
        when(stakingLedgerService.createPool(anyString(), anyString(), anyString(), any(), anyLong(), any()))
                .thenThrow(new LedgerAuthorizationException("mallory may not CREATE_POOL"));

        mockMvc.perform(post("/api/pools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "caller": "mallory",
                                  "stakingAsset": "STK",
                                  "rewardAsset": "RWD",
                                  "rewardRate": 1,
                                  "lockupPeriod": 0,
                                  "minStake": 1
                                }
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("not_authorized"));
    }

    @Test
    void listPoolsReturnsPoolsInOrder() throws Exception {
        when(stakingLedgerService.listPools()).thenReturn(List.of(samplePool(1L, true), samplePool(2L, false)));
        when(stakingLedgerService.rewardReserveBalance(any())).thenReturn(BigInteger.ZERO);

        mockMvc.perform(get("/api/pools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].poolId").value(1))
                .andExpect(jsonPath("$[1].poolId").value(2))
                .andExpect(jsonPath("$[1].active").value(false));
    }

    @Test
    void unknownPoolReturnsNotFound() throws Exception {
        when(stakingLedgerService.getPool(99L)).thenThrow(LedgerStateException.poolNotFound(99L));

        mockMvc.perform(get("/api/pools/{poolId}", 99))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("pool_not_found"));
    }

    @Test
    void nonNumericPoolIdReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/pools/{poolId}", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.poolId").value("has an invalid format"));
    }

    @Test
    void setRewardRateAcceptsZero() throws Exception {
        StakingPool paused = samplePool(1L, true);
        paused.setRewardRate(BigInteger.ZERO);
        when(stakingLedgerService.setRewardRate("admin", 1L, BigInteger.ZERO)).thenReturn(paused);
        when(stakingLedgerService.rewardReserveBalance(any())).thenReturn(BigInteger.ZERO);

        mockMvc.perform(put("/api/pools/{poolId}/reward-rate", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"caller": "admin", "rewardRate": 0}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rewardRate").value(0));
    }

    @Test
    void setPoolStatusRequiresActiveFlag() throws Exception {
        mockMvc.perform(put("/api/pools/{poolId}/status", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"caller": "admin"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.active").value("active is required"));

        verify(stakingLedgerService, never()).setPoolActive(anyString(), anyLong(), anyBoolean());
    }

    @Test
    void fundRewardsFailureReturnsConflict() throws Exception {
        when(stakingLedgerService.fundRewards(eq(1L), eq("treasury"), eq(BigInteger.valueOf(500))))
                .thenThrow(LedgerStateException.transferFailed("Insufficient RWD balance"));

        mockMvc.perform(post("/api/pools/{poolId}/rewards/fund", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"funder": "treasury", "amount": 500}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("transfer_failed"));
    }

    @Test
    void rewardPerTokenReportsScaledValue() throws Exception {
        when(stakingLedgerService.rewardPerToken(1L)).thenReturn(BigInteger.valueOf(42));

        mockMvc.perform(get("/api/pools/{poolId}/reward-per-token", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.poolId").value(1))
                .andExpect(jsonPath("$.rewardPerToken").value(42))
                .andExpect(jsonPath("$.precision").value(1_000_000_000_000_000_000L));
    }

    private static StakingPool samplePool(long poolId, boolean active) {
        StakingPool pool = new StakingPool();
        pool.setPoolId(poolId);
        pool.setStakingAsset("STK");
        pool.setRewardAsset("RWD");
        pool.setRewardRate(BigInteger.valueOf(100));
        pool.setLockupPeriod(3600L);
        pool.setMinStakeAmount(BigInteger.TEN);
        pool.setActive(active);
        pool.setCustodyAccount("pool:" + poolId + ":stake");
        pool.setRewardReserveAccount("pool:" + poolId + ":rewards");
        pool.setCreatedBy("admin");
        return pool;
    }
}

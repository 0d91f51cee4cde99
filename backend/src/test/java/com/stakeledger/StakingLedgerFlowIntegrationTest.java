package com.stakeledger;

import com.jayway.jsonpath.JsonPath;
import com.stakeledger.service.InMemoryAssetLedger;
import com.stakeledger.service.MutableLedgerClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class StakingLedgerFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableLedgerClock ledgerClock;

    @Autowired
    private InMemoryAssetLedger assetLedger;

    @Test
    void twoStakersSplitEmissionsProRata() throws Exception {
        long poolId = createFundedPool();
        assetLedger.mint("STK", "flow-alice", BigInteger.valueOf(1_000));
        assetLedger.mint("STK", "flow-bob", BigInteger.valueOf(1_000));

        stake(poolId, "flow-alice", 100, null);
        ledgerClock.advance(10);

        mockMvc.perform(get("/api/pools/{poolId}/stakes/{account}/earned", poolId, "flow-alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.earned").value(1000));

        mockMvc.perform(post("/api/pools/{poolId}/stakes/claim", poolId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"account\": \"flow-alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amountPaid").value(1000));

        stake(poolId, "flow-bob", 100, null);
        ledgerClock.advance(10);

        mockMvc.perform(get("/api/pools/{poolId}/stakes/{account}/earned", poolId, "flow-alice"))
                .andExpect(jsonPath("$.earned").value(500));
        mockMvc.perform(get("/api/pools/{poolId}/stakes/{account}/earned", poolId, "flow-bob"))
                .andExpect(jsonPath("$.earned").value(500));
        mockMvc.perform(get("/api/pools/{poolId}", poolId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalStaked").value(200))
                .andExpect(jsonPath("$.totalRewardsPaid").value(1000));

        assertEquals(BigInteger.valueOf(1_000), assetLedger.balanceOf("RWD", "flow-alice"));
        assertEquals(BigInteger.valueOf(900), assetLedger.balanceOf("STK", "flow-alice"));
    }

    @Test
    void retriedStakeWithSameIdempotencyKeyIsAppliedOnce() throws Exception {
        long poolId = createFundedPool();
        assetLedger.mint("STK", "flow-carol", BigInteger.valueOf(1_000));

        stake(poolId, "flow-carol", 250, "carol-stake-1");
        stake(poolId, "flow-carol", 250, "carol-stake-1");

        mockMvc.perform(get("/api/pools/{poolId}/stakes/{account}", poolId, "flow-carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(250))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
        assertEquals(BigInteger.valueOf(750), assetLedger.balanceOf("STK", "flow-carol"));

        mockMvc.perform(post("/api/pools/{poolId}/stakes/withdraw", poolId)
                        .header("Idempotency-Key", "carol-stake-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"account\": \"flow-carol\", \"amount\": 250}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("idempotency_key_reused"));
    }

    @Test
    void healthReportsStakingLedgerIndicator() throws Exception {
        createFundedPool();

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.stakingLedger.status").value("UP"));
    }

    private long createFundedPool() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/pools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "caller": "admin",
                                  "stakingAsset": "STK",
                                  "rewardAsset": "RWD",
                                  "rewardRate": 100,
                                  "lockupPeriod": 0,
                                  "minStake": 1
                                }
                                """))
                .andExpect(status().isCreated())
                .andReturn();
        long poolId = ((Number) JsonPath.read(created.getResponse().getContentAsString(), "$.poolId")).longValue();

        assetLedger.mint("RWD", "flow-treasury", BigInteger.valueOf(1_000_000));
        mockMvc.perform(post("/api/pools/{poolId}/rewards/fund", poolId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"funder\": \"flow-treasury\", \"amount\": 1000000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rewardReserveBalance").value(1000000));
        return poolId;
    }

    private void stake(long poolId, String account, long amount, String idempotencyKey) throws Exception {
        var request = post("/api/pools/{poolId}/stakes", poolId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"account\": \"" + account + "\", \"amount\": " + amount + "}");
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        mockMvc.perform(request).andExpect(status().isOk());
    }

    @TestConfiguration
    static class FixedClockConfiguration {

        @Bean
        @Primary
        MutableLedgerClock mutableLedgerClock() {
            return new MutableLedgerClock(1_700_000_000L);
        }
    }
}

package com.stakeledger.controller;

import com.stakeledger.controller.dto.LedgerRequests;
import com.stakeledger.controller.dto.LedgerResponses;
import com.stakeledger.mapper.LedgerResponseMapper;
import com.stakeledger.model.StakingPool;
import com.stakeledger.service.RewardMath;
import com.stakeledger.service.StakingLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Pool administration and pool-level queries.
 */
@RestController
@RequestMapping("/api/pools")
public class PoolController {

    private final StakingLedgerService stakingLedgerService;
    private final LedgerResponseMapper ledgerResponseMapper;

    public PoolController(StakingLedgerService stakingLedgerService, LedgerResponseMapper ledgerResponseMapper) {
        this.stakingLedgerService = stakingLedgerService;
        this.ledgerResponseMapper = ledgerResponseMapper;
    }

    @PostMapping
    public ResponseEntity<LedgerResponses.PoolDetail> createPool(
            @Valid @RequestBody LedgerRequests.CreatePoolRequest request
    ) {
        StakingPool pool = stakingLedgerService.createPool(
                request.caller(),
                request.stakingAsset(),
                request.rewardAsset(),
                request.rewardRate(),
                request.lockupPeriod(),
                request.minStake()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(pool));
    }

    @GetMapping
    public ResponseEntity<List<LedgerResponses.PoolDetail>> listPools() {
        return ResponseEntity.ok(stakingLedgerService.listPools().stream()
                .map(this::toDetail)
                .toList());
    }

    @GetMapping("/{poolId}")
    public ResponseEntity<LedgerResponses.PoolDetail> getPool(@PathVariable long poolId) {
        return ResponseEntity.ok(toDetail(stakingLedgerService.getPool(poolId)));
    }

    @PutMapping("/{poolId}/reward-rate")
    public ResponseEntity<LedgerResponses.PoolDetail> setRewardRate(
            @PathVariable long poolId,
            @Valid @RequestBody LedgerRequests.RewardRateUpdateRequest request
    ) {
        StakingPool pool = stakingLedgerService.setRewardRate(request.caller(), poolId, request.rewardRate());
        return ResponseEntity.ok(toDetail(pool));
    }

    @PutMapping("/{poolId}/status")
    public ResponseEntity<LedgerResponses.PoolDetail> setPoolStatus(
            @PathVariable long poolId,
            @Valid @RequestBody LedgerRequests.PoolStatusUpdateRequest request
    ) {
        StakingPool pool = stakingLedgerService.setPoolActive(request.caller(), poolId, request.active());
        return ResponseEntity.ok(toDetail(pool));
    }

    @PostMapping("/{poolId}/rewards/fund")
    public ResponseEntity<LedgerResponses.PoolDetail> fundRewards(
            @PathVariable long poolId,
            @Valid @RequestBody LedgerRequests.FundRewardsRequest request
    ) {
        StakingPool pool = stakingLedgerService.fundRewards(poolId, request.funder(), request.amount());
        return ResponseEntity.ok(toDetail(pool));
    }

    @GetMapping("/{poolId}/reward-per-token")
    public ResponseEntity<LedgerResponses.RewardPerTokenResponse> rewardPerToken(@PathVariable long poolId) {
        return ResponseEntity.ok(new LedgerResponses.RewardPerTokenResponse(
                poolId,
                stakingLedgerService.rewardPerToken(poolId),
                RewardMath.PRECISION
        ));
    }

    private LedgerResponses.PoolDetail toDetail(StakingPool pool) {
        return ledgerResponseMapper.toPoolDetailResponse(pool, stakingLedgerService.rewardReserveBalance(pool));
    }
}

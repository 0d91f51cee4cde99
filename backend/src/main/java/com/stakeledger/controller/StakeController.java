package com.stakeledger.controller;

import com.stakeledger.controller.dto.LedgerRequests;
import com.stakeledger.controller.dto.LedgerResponses;
import com.stakeledger.mapper.LedgerResponseMapper;
import com.stakeledger.service.IdempotencyRegistry;
import com.stakeledger.service.StakingLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account-facing stake operations. Mutating endpoints accept an optional
 * Idempotency-Key header so client retries do not stake or pay twice.
 */
@RestController
@RequestMapping("/api/pools/{poolId}/stakes")
public class StakeController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final StakingLedgerService stakingLedgerService;
    private final IdempotencyRegistry idempotencyRegistry;
    private final LedgerResponseMapper ledgerResponseMapper;

    public StakeController(
            StakingLedgerService stakingLedgerService,
            IdempotencyRegistry idempotencyRegistry,
            LedgerResponseMapper ledgerResponseMapper
    ) {
        this.stakingLedgerService = stakingLedgerService;
        this.idempotencyRegistry = idempotencyRegistry;
        this.ledgerResponseMapper = ledgerResponseMapper;
    }

    @PostMapping
    public ResponseEntity<LedgerResponses.StakeDetail> stake(
            @PathVariable long poolId,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody LedgerRequests.StakeAmountRequest request
    ) {
        LedgerResponses.StakeDetail detail = idempotencyRegistry.execute(
                idempotencyScope(request.account()),
                idempotencyKey,
                "stake|" + poolId + "|" + request.amount(),
                () -> ledgerResponseMapper.toStakeDetailResponse(
                        stakingLedgerService.stake(poolId, request.account(), request.amount())
                )
        );
        return ResponseEntity.ok(detail);
    }

    @PostMapping("/withdraw")
    public ResponseEntity<LedgerResponses.StakeDetail> withdraw(
            @PathVariable long poolId,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody LedgerRequests.StakeAmountRequest request
    ) {
        LedgerResponses.StakeDetail detail = idempotencyRegistry.execute(
                idempotencyScope(request.account()),
                idempotencyKey,
                "withdraw|" + poolId + "|" + request.amount(),
                () -> ledgerResponseMapper.toStakeDetailResponse(
                        stakingLedgerService.withdraw(poolId, request.account(), request.amount())
                )
        );
        return ResponseEntity.ok(detail);
    }

    @PostMapping("/claim")
    public ResponseEntity<LedgerResponses.RewardClaimResponse> claimReward(
            @PathVariable long poolId,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody LedgerRequests.AccountRequest request
    ) {
        LedgerResponses.RewardClaimResponse claim = idempotencyRegistry.execute(
                idempotencyScope(request.account()),
                idempotencyKey,
                "claim|" + poolId,
                () -> ledgerResponseMapper.toRewardClaimResponse(
                        stakingLedgerService.claimReward(poolId, request.account())
                )
        );
        return ResponseEntity.ok(claim);
    }

    @PostMapping("/exit")
    public ResponseEntity<LedgerResponses.ExitResponse> exit(
            @PathVariable long poolId,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody LedgerRequests.AccountRequest request
    ) {
        LedgerResponses.ExitResponse exit = idempotencyRegistry.execute(
                idempotencyScope(request.account()),
                idempotencyKey,
                "exit|" + poolId,
                () -> ledgerResponseMapper.toExitResponse(stakingLedgerService.exit(poolId, request.account()))
        );
        return ResponseEntity.ok(exit);
    }

    @GetMapping("/{account}")
    public ResponseEntity<LedgerResponses.StakeDetail> getStakeInfo(
            @PathVariable long poolId,
            @PathVariable String account
    ) {
        return ResponseEntity.ok(ledgerResponseMapper.toStakeDetailResponse(
                stakingLedgerService.getStakeInfo(poolId, account)
        ));
    }

    @GetMapping("/{account}/earned")
    public ResponseEntity<LedgerResponses.EarnedResponse> earned(
            @PathVariable long poolId,
            @PathVariable String account
    ) {
        return ResponseEntity.ok(new LedgerResponses.EarnedResponse(
                poolId,
                account,
                stakingLedgerService.earned(poolId, account)
        ));
    }

    private static String idempotencyScope(String account) {
        return account.trim();
    }
}

package com.stakeledger.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigInteger;

public final class LedgerRequests {

    private LedgerRequests() {
    }

    public record CreatePoolRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotBlank(message = "stakingAsset is required")
            @Size(max = 128, message = "stakingAsset must be at most 128 characters")
            String stakingAsset,

            @NotBlank(message = "rewardAsset is required")
            @Size(max = 128, message = "rewardAsset must be at most 128 characters")
            String rewardAsset,

            @NotNull(message = "rewardRate is required")
            @Positive(message = "rewardRate must be positive")
            BigInteger rewardRate,

            @NotNull(message = "lockupPeriod is required")
            @PositiveOrZero(message = "lockupPeriod must not be negative")
            Long lockupPeriod,

            @NotNull(message = "minStake is required")
            @Positive(message = "minStake must be positive")
            BigInteger minStake
    ) {
    }

    public record StakeAmountRequest(
            @NotBlank(message = "account is required")
            String account,

            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            BigInteger amount
    ) {
    }

    public record AccountRequest(
            @NotBlank(message = "account is required")
            String account
    ) {
    }

    public record RewardRateUpdateRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotNull(message = "rewardRate is required")
            @PositiveOrZero(message = "rewardRate must not be negative")
            BigInteger rewardRate
    ) {
    }

    public record PoolStatusUpdateRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotNull(message = "active is required")
            Boolean active
    ) {
    }

    public record FundRewardsRequest(
            @NotBlank(message = "funder is required")
            String funder,

            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            BigInteger amount
    ) {
    }
}

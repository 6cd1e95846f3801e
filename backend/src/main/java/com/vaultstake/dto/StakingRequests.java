package com.vaultstake.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public final class StakingRequests {

    /**
     * Upper bound for any duration given in hours, one hundred years.
     */
    public static final long MAX_HOURS = 876_000L;

    private StakingRequests() {
    }

    public record InitializeRequest(
            @NotBlank(message = "collectionAddress is required")
            @Size(max = 128, message = "collectionAddress must be at most 128 characters")
            String collectionAddress,

            @NotBlank(message = "rewardTokenAddress is required")
            @Size(max = 128, message = "rewardTokenAddress must be at most 128 characters")
            String rewardTokenAddress,

            @NotNull(message = "rewardPerBlock is required")
            @Min(value = 0, message = "rewardPerBlock must be non-negative")
            Long rewardPerBlock,

            @NotNull(message = "earlyExitTax is required")
            @Min(value = 0, message = "earlyExitTax must be non-negative")
            Long earlyExitTax,

            @NotNull(message = "stakeLimit is required")
            @Min(value = 0, message = "stakeLimit must be non-negative")
            Long stakeLimit,

            @NotNull(message = "carryAmount is required")
            @Min(value = 0, message = "carryAmount must be non-negative")
            Long carryAmount,

            @NotNull(message = "stakingDurationHours is required")
            @Positive(message = "stakingDurationHours must be positive")
            @Max(value = MAX_HOURS, message = "stakingDurationHours must be at most 876000")
            Long stakingDurationHours,

            @NotNull(message = "unbondingPeriodHours is required")
            @Min(value = 0, message = "unbondingPeriodHours must be non-negative")
            @Max(value = MAX_HOURS, message = "unbondingPeriodHours must be at most 876000")
            Long unbondingPeriodHours
    ) {
    }

    public record UpdateAmountRequest(
            @NotNull(message = "value is required")
            @Min(value = 0, message = "value must be non-negative")
            Long value
    ) {
    }

    public record UpdateDurationRequest(
            @NotNull(message = "hours is required")
            @Min(value = 0, message = "hours must be non-negative")
            @Max(value = MAX_HOURS, message = "hours must be at most 876000")
            Long hours
    ) {
    }

    public record AssetReceiptRequest(
            @NotBlank(message = "assetId is required")
            String assetId,

            @NotBlank(message = "from is required")
            String from,

            String operator
    ) {
    }

    public record MintAssetRequest(
            @NotBlank(message = "assetId is required")
            @Size(max = 128, message = "assetId must be at most 128 characters")
            String assetId,

            @NotBlank(message = "holder is required")
            String holder
    ) {
    }

    public record CreditTokensRequest(
            @NotBlank(message = "holder is required")
            String holder,

            @NotNull(message = "amount is required")
            @Min(value = 0, message = "amount must be non-negative")
            Long amount
    ) {
    }
}

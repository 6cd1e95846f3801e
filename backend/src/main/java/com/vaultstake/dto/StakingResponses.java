package com.vaultstake.dto;

import com.vaultstake.model.StakeState;

import java.time.OffsetDateTime;
import java.util.List;

public final class StakingResponses {

    private StakingResponses() {
    }

    public record StakeInfo(
            String assetId,
            String ownerWallet,
            StakeState state,
            OffsetDateTime stakedAt,
            OffsetDateTime unbondingAt,
            long lastClaimedBlock,
            long carryDeposit
    ) {
    }

    public record UnstakeResult(
            StakeInfo stake,
            long rewardPaid,
            long taxCharged
    ) {
    }

    public record WithdrawResult(
            String assetId,
            String ownerWallet,
            long rewardPaid,
            long taxCharged,
            long carryReturned,
            boolean afterStakingEnd
    ) {
    }

    public record ClaimResult(
            String assetId,
            long rewardPaid,
            long lastClaimedBlock
    ) {
    }

    public record ClaimAllResult(
            String ownerWallet,
            List<ClaimResult> claims,
            long totalRewardPaid
    ) {
    }

    public record PendingReward(
            String assetId,
            long pendingReward,
            long effectiveBlockHeight
    ) {
    }

    public record UnbondingTimestamp(
            String assetId,
            OffsetDateTime unbondingAt
    ) {
    }

    public record StakeCount(
            String ownerWallet,
            long count
    ) {
    }

    public record PoolSummary(
            boolean initialized,
            boolean paused,
            String collectionAddress,
            String rewardTokenAddress,
            OffsetDateTime stakingEndTime,
            long unbondingPeriodSeconds,
            long rewardPerBlock,
            long stakeLimit,
            long carryAmount,
            long earlyExitTax,
            long totalStakes,
            long activeStakeCount,
            long currentBlockHeight
    ) {
    }

    public record RewardPoolWithdrawal(
            String recipient,
            long amount
    ) {
    }

    public record AssetWithdrawal(
            String assetId,
            String recipient,
            boolean entryRemoved,
            long carryReturned
    ) {
    }

    public record AssetReceiptAck(
            String assetId,
            boolean accepted
    ) {
    }

    public record TokenBalanceResponse(
            String holder,
            long balance
    ) {
    }
}

package com.vaultstake.service;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakingPool;
import com.vaultstake.web.StakingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Pro-rata reward accrual for staked entries.
 *
 * reward = (effectiveHeight - lastClaimedBlock) x (rewardPerBlock / activeStakesCount)
 *
 * The per-stake share is truncated before it is multiplied by the elapsed
 * blocks; existing payouts depend on that rounding. After the staking period
 * ends the effective height is pinned to the estimated height at the end time.
 */
@Service
public class RewardAccrualService {

    private static final Logger log = LoggerFactory.getLogger(RewardAccrualService.class);

    private final StakingProperties stakingProperties;

    public RewardAccrualService(StakingProperties stakingProperties) {
        this.stakingProperties = stakingProperties;
    }

    public RewardQuote quote(StakingPool pool, StakeEntry entry, OffsetDateTime now, long currentHeight) {
        if (!entry.isStaked()) {
            throw StakingException.notStaked(entry.getAssetId());
        }

        long effectiveHeight = effectiveBlockHeight(pool, now, currentHeight);
        long activeStakes = pool.getActiveStakesCount();
        if (activeStakes <= 0) {
            log.warn("Reward quote for asset {} requested with no active stakes", entry.getAssetId());
            return new RewardQuote(0L, effectiveHeight);
        }

        long elapsedBlocks = effectiveHeight - entry.getLastClaimedBlock();
        if (elapsedBlocks <= 0) {
            return new RewardQuote(0L, effectiveHeight);
        }

        long perStakeShare = pool.getRewardPerBlock() / activeStakes;
        return new RewardQuote(Math.multiplyExact(elapsedBlocks, perStakeShare), effectiveHeight);
    }

    /**
     * Computes the pending reward and advances the entry's claim marker to the
     * current height. The caller pays the returned amount out.
     */
    public long settle(StakingPool pool, StakeEntry entry, OffsetDateTime now, long currentHeight) {
        RewardQuote quote = quote(pool, entry, now, currentHeight);
        entry.setLastClaimedBlock(currentHeight);
        return quote.amount();
    }

    public long effectiveBlockHeight(StakingPool pool, OffsetDateTime now, long currentHeight) {
        OffsetDateTime stakingEndTime = pool.getStakingEndTime();
        if (stakingEndTime == null || !now.isAfter(stakingEndTime)) {
            return currentHeight;
        }
        return blockHeightAt(stakingEndTime, now, currentHeight);
    }

    /**
     * Estimates the block height at a past timestamp from the current height
     * and the average block time.
     */
    long blockHeightAt(OffsetDateTime timestamp, OffsetDateTime now, long currentHeight) {
        if (!timestamp.isBefore(now)) {
            throw StakingException.pastTimestampRequired();
        }
        long elapsedBlocks = Duration.between(timestamp, now).toMillis() / stakingProperties.getAverageBlockTimeMs();
        return Math.max(0L, currentHeight - elapsedBlocks);
    }

    public record RewardQuote(
            long amount,
            long effectiveBlockHeight
    ) {
    }
}

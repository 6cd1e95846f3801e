package com.vaultstake.mapper;

import com.vaultstake.dto.StakingResponses;
import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakingPool;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class StakingResponseMapper {

    public StakingResponses.StakeInfo toStakeInfo(StakeEntry entry) {
        return new StakingResponses.StakeInfo(
                entry.getAssetId(),
                entry.getOwnerWallet(),
                entry.getState(),
                entry.getStakedAt(),
                entry.getUnbondingAt(),
                entry.getLastClaimedBlock(),
                entry.getCarryDeposit()
        );
    }

    public List<StakingResponses.StakeInfo> toStakeInfos(Collection<StakeEntry> entries) {
        return entries.stream()
                .map(this::toStakeInfo)
                .toList();
    }

    public StakingResponses.PoolSummary toPoolSummary(StakingPool pool, long currentBlockHeight) {
        return new StakingResponses.PoolSummary(
                pool.isInitialized(),
                pool.isPaused(),
                pool.getCollectionAddress(),
                pool.getRewardTokenAddress(),
                pool.getStakingEndTime(),
                pool.getUnbondingPeriodSeconds(),
                pool.getRewardPerBlock(),
                pool.getStakeLimit(),
                pool.getCarryAmount(),
                pool.getEarlyExitTax(),
                pool.getStakesCount(),
                pool.getActiveStakesCount(),
                currentBlockHeight
        );
    }
}

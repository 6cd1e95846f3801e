package com.vaultstake.service;

import com.vaultstake.chain.ChainClock;
import com.vaultstake.custody.AssetCustodian;
import com.vaultstake.custody.RewardTokenLedger;
import com.vaultstake.dto.StakingRequests;
import com.vaultstake.dto.StakingResponses;
import com.vaultstake.mapper.StakingResponseMapper;
import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakingPool;
import com.vaultstake.security.StakingAction;
import com.vaultstake.security.StakingAuthorization;
import com.vaultstake.security.WalletAddresses;
import com.vaultstake.web.StakingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Privileged pool configuration, pausing and emergency withdrawals.
 */
@Service
public class StakingAdminService {

    private static final Logger log = LoggerFactory.getLogger(StakingAdminService.class);

    private final StakingPoolService stakingPoolService;
    private final StakeRegistry stakeRegistry;
    private final StakingAuthorization stakingAuthorization;
    private final AssetCustodian assetCustodian;
    private final RewardTokenLedger rewardTokenLedger;
    private final ChainClock chainClock;
    private final ReentrancyGuard reentrancyGuard;
    private final StakingResponseMapper stakingResponseMapper;

    public StakingAdminService(
            StakingPoolService stakingPoolService,
            StakeRegistry stakeRegistry,
            StakingAuthorization stakingAuthorization,
            AssetCustodian assetCustodian,
            RewardTokenLedger rewardTokenLedger,
            ChainClock chainClock,
            ReentrancyGuard reentrancyGuard,
            StakingResponseMapper stakingResponseMapper
    ) {
        this.stakingPoolService = stakingPoolService;
        this.stakeRegistry = stakeRegistry;
        this.stakingAuthorization = stakingAuthorization;
        this.assetCustodian = assetCustodian;
        this.rewardTokenLedger = rewardTokenLedger;
        this.chainClock = chainClock;
        this.reentrancyGuard = reentrancyGuard;
        this.stakingResponseMapper = stakingResponseMapper;
    }

    @Transactional
    public StakingResponses.PoolSummary initialize(String callerWallet, StakingRequests.InitializeRequest request) {
        requireAuthorized(callerWallet, StakingAction.INITIALIZE);
        return reentrancyGuard.guard(() -> initializePool(request));
    }

    /**
     * One-time initialisation without an authorization check. Used by the
     * startup bootstrap.
     */
    @Transactional
    public StakingResponses.PoolSummary initializePool(StakingRequests.InitializeRequest request) {
        StakingPool pool = stakingPoolService.lockPool();
        if (pool.isInitialized()) {
            throw StakingException.alreadyInitialized();
        }

        OffsetDateTime now = chainClock.now();
        pool.setCollectionAddress(request.collectionAddress().trim());
        pool.setRewardTokenAddress(request.rewardTokenAddress().trim());
        pool.setRewardPerBlock(request.rewardPerBlock());
        pool.setEarlyExitTax(request.earlyExitTax());
        pool.setStakeLimit(request.stakeLimit());
        pool.setCarryAmount(request.carryAmount());
        pool.setStakingEndTime(now.plus(hours(request.stakingDurationHours())));
        pool.setUnbondingPeriodSeconds(hours(request.unbondingPeriodHours()).toSeconds());
        pool.setInitialized(true);
        pool.setPaused(false);
        pool.setInitializedAt(now);
        pool.setUpdatedAt(now);
        StakingPool saved = stakingPoolService.save(pool);

        log.info("Initialized staking pool: collection={}, rewardToken={}, rewardPerBlock={}, stakeLimit={}, "
                        + "carryAmount={}, earlyExitTax={}, stakingEndTime={}, unbondingPeriodSeconds={}",
                saved.getCollectionAddress(), saved.getRewardTokenAddress(), saved.getRewardPerBlock(),
                saved.getStakeLimit(), saved.getCarryAmount(), saved.getEarlyExitTax(),
                saved.getStakingEndTime(), saved.getUnbondingPeriodSeconds());
        return summary(saved);
    }

    @Transactional
    public StakingResponses.PoolSummary setStakeLimit(String callerWallet, long stakeLimit) {
        return update(callerWallet, StakingAction.SET_STAKE_LIMIT, pool -> pool.setStakeLimit(stakeLimit));
    }

    @Transactional
    public StakingResponses.PoolSummary setRewardPerBlock(String callerWallet, long rewardPerBlock) {
        return update(callerWallet, StakingAction.SET_REWARD_PER_BLOCK, pool -> pool.setRewardPerBlock(rewardPerBlock));
    }

    @Transactional
    public StakingResponses.PoolSummary setEarlyExitTax(String callerWallet, long earlyExitTax) {
        return update(callerWallet, StakingAction.SET_EARLY_EXIT_TAX, pool -> pool.setEarlyExitTax(earlyExitTax));
    }

    @Transactional
    public StakingResponses.PoolSummary setCarryAmount(String callerWallet, long carryAmount) {
        return update(callerWallet, StakingAction.SET_CARRY_AMOUNT, pool -> pool.setCarryAmount(carryAmount));
    }

    @Transactional
    public StakingResponses.PoolSummary setStakingEndTime(String callerWallet, long hoursFromNow) {
        OffsetDateTime stakingEndTime = chainClock.now().plus(hours(hoursFromNow));
        return update(callerWallet, StakingAction.SET_STAKING_END_TIME, pool -> pool.setStakingEndTime(stakingEndTime));
    }

    @Transactional
    public StakingResponses.PoolSummary setUnbondingPeriod(String callerWallet, long unbondingHours) {
        long seconds = hours(unbondingHours).toSeconds();
        return update(callerWallet, StakingAction.SET_UNBONDING_PERIOD, pool -> pool.setUnbondingPeriodSeconds(seconds));
    }

    @Transactional
    public StakingResponses.PoolSummary pause(String callerWallet) {
        return update(callerWallet, StakingAction.PAUSE, pool -> pool.setPaused(true));
    }

    @Transactional
    public StakingResponses.PoolSummary unpause(String callerWallet) {
        return update(callerWallet, StakingAction.UNPAUSE, pool -> pool.setPaused(false));
    }

    /**
     * Sends the reward pool to the caller. Carry deposits still owed to stakers
     * stay in the vault.
     */
    @Transactional
    public StakingResponses.RewardPoolWithdrawal forceWithdrawRewardPool(String callerWallet) {
        String caller = requireAuthorized(callerWallet, StakingAction.WITHDRAW_REWARD_POOL);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            long amount = Math.max(0L, rewardTokenLedger.vaultBalance() - pool.getCarryDepositsHeld());
            if (amount > 0) {
                rewardTokenLedger.transferOut(caller, amount);
            }
            log.info("Withdrew {} reward tokens from the reward pool to {}", amount, caller);
            return new StakingResponses.RewardPoolWithdrawal(caller, amount);
        });
    }

    /**
     * Pulls an asset out of custody. A staked asset goes back to its owner with
     * its carry deposit and its entry is removed; an asset without an entry goes
     * to the caller.
     */
    @Transactional
    public StakingResponses.AssetWithdrawal forceWithdrawAsset(String callerWallet, String assetId) {
        String caller = requireAuthorized(callerWallet, StakingAction.WITHDRAW_ASSET);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            Optional<StakeEntry> existing = stakeRegistry.get(assetId);
            if (existing.isEmpty()) {
                assetCustodian.releaseFromCustody(caller, assetId);
                log.info("Released untracked asset {} from custody to {}", assetId, caller);
                return new StakingResponses.AssetWithdrawal(assetId, caller, false, 0L);
            }

            StakeEntry entry = existing.get();
            if (entry.isStaked()) {
                pool.setActiveStakesCount(pool.getActiveStakesCount() - 1);
            }
            stakeRegistry.remove(pool, assetId);
            pool.setCarryDepositsHeld(pool.getCarryDepositsHeld() - entry.getCarryDeposit());
            pool.setUpdatedAt(chainClock.now());
            stakingPoolService.save(pool);

            TransferPlan plan = new TransferPlan();
            plan.returnAsset(assetId);
            plan.returnCarry(entry.getCarryDeposit());
            plan.execute(entry.getOwnerWallet(), assetCustodian, rewardTokenLedger);

            log.info("Force-withdrew staked asset {} to its owner {} on behalf of {}",
                    assetId, entry.getOwnerWallet(), caller);
            return new StakingResponses.AssetWithdrawal(
                    assetId,
                    entry.getOwnerWallet(),
                    true,
                    plan.carryReturned()
            );
        });
    }

    private StakingResponses.PoolSummary update(
            String callerWallet,
            StakingAction action,
            Consumer<StakingPool> change
    ) {
        requireAuthorized(callerWallet, action);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            change.accept(pool);
            pool.setUpdatedAt(chainClock.now());
            StakingPool saved = stakingPoolService.save(pool);
            log.info("Applied {} to staking pool", action);
            return summary(saved);
        });
    }

    private String requireAuthorized(String callerWallet, StakingAction action) {
        String caller = WalletAddresses.normalize(callerWallet);
        if (!stakingAuthorization.isAuthorized(caller, action)) {
            log.warn("Rejected {} from unauthorized caller {}", action, caller);
            throw StakingException.unauthorized(action.name());
        }
        return caller;
    }

    private StakingResponses.PoolSummary summary(StakingPool pool) {
        return stakingResponseMapper.toPoolSummary(pool, chainClock.currentBlockHeight());
    }

    private static Duration hours(long hours) {
        if (hours < 0 || hours > StakingRequests.MAX_HOURS) {
            throw new IllegalArgumentException(
                    "Duration in hours must be between 0 and " + StakingRequests.MAX_HOURS + ": " + hours);
        }
        return Duration.ofHours(hours);
    }
}

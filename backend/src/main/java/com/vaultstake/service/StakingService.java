package com.vaultstake.service;

import com.vaultstake.chain.ChainClock;
import com.vaultstake.custody.AssetCustodian;
import com.vaultstake.custody.RewardTokenLedger;
import com.vaultstake.dto.StakingResponses;
import com.vaultstake.mapper.StakingResponseMapper;
import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakeState;
import com.vaultstake.model.StakingPool;
import com.vaultstake.security.PauseGate;
import com.vaultstake.security.WalletAddresses;
import com.vaultstake.web.StakingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-asset staking lifecycle: STAKED, then UNBONDING or FREE, then removed on withdraw.
 *
 * Every mutating operation runs in one transaction under the pool row lock and
 * the reentrancy guard. Ledger state is written before any custody transfer;
 * a failed transfer rolls the whole operation back.
 */
@Service
public class StakingService {

    private static final Logger log = LoggerFactory.getLogger(StakingService.class);

    private final StakeRegistry stakeRegistry;
    private final StakingPoolService stakingPoolService;
    private final RewardAccrualService rewardAccrualService;
    private final AssetCustodian assetCustodian;
    private final RewardTokenLedger rewardTokenLedger;
    private final ChainClock chainClock;
    private final PauseGate pauseGate;
    private final ReentrancyGuard reentrancyGuard;
    private final StakingResponseMapper stakingResponseMapper;

    public StakingService(
            StakeRegistry stakeRegistry,
            StakingPoolService stakingPoolService,
            RewardAccrualService rewardAccrualService,
            AssetCustodian assetCustodian,
            RewardTokenLedger rewardTokenLedger,
            ChainClock chainClock,
            PauseGate pauseGate,
            ReentrancyGuard reentrancyGuard,
            StakingResponseMapper stakingResponseMapper
    ) {
        this.stakeRegistry = stakeRegistry;
        this.stakingPoolService = stakingPoolService;
        this.rewardAccrualService = rewardAccrualService;
        this.assetCustodian = assetCustodian;
        this.rewardTokenLedger = rewardTokenLedger;
        this.chainClock = chainClock;
        this.pauseGate = pauseGate;
        this.reentrancyGuard = reentrancyGuard;
        this.stakingResponseMapper = stakingResponseMapper;
    }

    @Transactional
    public StakingResponses.StakeInfo stake(String assetId, String callerWallet) {
        String caller = WalletAddresses.normalize(callerWallet);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            requireNotPaused();
            OffsetDateTime now = chainClock.now();

            if (pool.hasStakingEnded(now)) {
                throw StakingException.stakingPeriodEnded();
            }
            if (pool.getActiveStakesCount() >= pool.getStakeLimit()) {
                throw StakingException.stakeLimitExceeded(pool.getStakeLimit());
            }
            String holder = assetCustodian.holderOf(assetId).orElse(null);
            if (!caller.equals(holder)) {
                throw StakingException.callerNotAssetHolder(assetId);
            }

            StakeEntry entry = new StakeEntry();
            entry.setAssetId(assetId);
            entry.setOwnerWallet(caller);
            entry.setState(StakeState.STAKED);
            entry.setStakedAt(now);
            entry.setUnbondingAt(null);
            entry.setLastClaimedBlock(chainClock.currentBlockHeight());
            entry.setCarryDeposit(pool.getCarryAmount());
            entry.setUpdatedAt(now);
            StakeEntry saved = stakeRegistry.add(pool, entry, now);

            pool.setActiveStakesCount(pool.getActiveStakesCount() + 1);
            pool.setCarryDepositsHeld(Math.addExact(pool.getCarryDepositsHeld(), saved.getCarryDeposit()));
            pool.setUpdatedAt(now);
            stakingPoolService.save(pool);

            if (saved.getCarryDeposit() > 0) {
                rewardTokenLedger.transferIn(caller, saved.getCarryDeposit());
            }
            assetCustodian.depositIntoCustody(caller, assetId);

            log.info("Staked asset {} for {} at block {}, activeStakes={}",
                    assetId, caller, saved.getLastClaimedBlock(), pool.getActiveStakesCount());
            return stakingResponseMapper.toStakeInfo(saved);
        });
    }

    @Transactional
    public StakingResponses.UnstakeResult unstake(String assetId, String callerWallet, boolean forceWithTax) {
        String caller = WalletAddresses.normalize(callerWallet);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            requireNotPaused();
            OffsetDateTime now = chainClock.now();

            if (pool.hasStakingEnded(now)) {
                throw StakingException.stakingPeriodEnded();
            }
            StakeEntry entry = requireEntry(assetId);
            if (!entry.isStaked()) {
                throw StakingException.notStaked(assetId);
            }
            requireOwner(entry, caller);

            TransferPlan plan = new TransferPlan();
            applyUnstake(pool, entry, forceWithTax, now, plan);
            pool.setUpdatedAt(now);
            stakingPoolService.save(pool);

            plan.execute(caller, assetCustodian, rewardTokenLedger);
            return new StakingResponses.UnstakeResult(
                    stakingResponseMapper.toStakeInfo(entry),
                    plan.rewardPaid(),
                    plan.taxCharged()
            );
        });
    }

    @Transactional
    public StakingResponses.WithdrawResult withdraw(String assetId, String callerWallet, boolean forceWithTax) {
        String caller = WalletAddresses.normalize(callerWallet);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            requireNotPaused();
            OffsetDateTime now = chainClock.now();

            StakeEntry entry = requireEntry(assetId);
            requireOwner(entry, caller);

            TransferPlan plan = new TransferPlan();
            boolean stakingEnded = pool.hasStakingEnded(now);
            if (!stakingEnded) {
                boolean insideLockWindow = entry.getUnbondingAt() != null && now.isBefore(entry.getUnbondingAt());
                if (insideLockWindow && !forceWithTax) {
                    throw StakingException.forcedExitRequired(assetId);
                }
                if (entry.isStaked()) {
                    applyUnstake(pool, entry, forceWithTax, now, plan);
                } else if (entry.getState() == StakeState.UNBONDING && forceWithTax && insideLockWindow) {
                    plan.chargeTax(pool.getEarlyExitTax());
                    entry.setState(StakeState.FREE);
                    entry.setUnbondingAt(now);
                }
            } else if (entry.isStaked()) {
                pool.setActiveStakesCount(pool.getActiveStakesCount() - 1);
            }

            stakeRegistry.remove(pool, assetId);
            pool.setCarryDepositsHeld(pool.getCarryDepositsHeld() - entry.getCarryDeposit());
            pool.setUpdatedAt(now);
            stakingPoolService.save(pool);

            plan.returnAsset(assetId);
            plan.returnCarry(entry.getCarryDeposit());
            plan.execute(caller, assetCustodian, rewardTokenLedger);

            log.info("Withdrew asset {} to {}: reward={}, tax={}, carry={}, afterStakingEnd={}",
                    assetId, caller, plan.rewardPaid(), plan.taxCharged(), plan.carryReturned(), stakingEnded);
            return new StakingResponses.WithdrawResult(
                    assetId,
                    caller,
                    plan.rewardPaid(),
                    plan.taxCharged(),
                    plan.carryReturned(),
                    stakingEnded
            );
        });
    }

    @Transactional
    public StakingResponses.ClaimResult claimReward(String assetId, String callerWallet) {
        String caller = WalletAddresses.normalize(callerWallet);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            requireNotPaused();
            StakeEntry entry = requireEntry(assetId);
            if (!entry.isStaked()) {
                throw StakingException.notStaked(assetId);
            }
            requireOwner(entry, caller);

            TransferPlan plan = new TransferPlan();
            StakingResponses.ClaimResult result =
                    settleClaim(pool, entry, chainClock.now(), chainClock.currentBlockHeight(), plan);
            plan.execute(caller, assetCustodian, rewardTokenLedger);
            return result;
        });
    }

    @Transactional
    public StakingResponses.ClaimAllResult claimAllRewards(String callerWallet) {
        String caller = WalletAddresses.normalize(callerWallet);
        return reentrancyGuard.guard(() -> {
            StakingPool pool = stakingPoolService.lockInitializedPool();
            requireNotPaused();
            OffsetDateTime now = chainClock.now();
            long currentHeight = chainClock.currentBlockHeight();

            TransferPlan plan = new TransferPlan();
            List<StakingResponses.ClaimResult> claims = new ArrayList<>();
            for (StakeEntry entry : stakeRegistry.listByOwner(caller)) {
                if (!entry.isStaked()) {
                    log.debug("Skipping claim for asset {} in state {}", entry.getAssetId(), entry.getState());
                    continue;
                }
                claims.add(settleClaim(pool, entry, now, currentHeight, plan));
            }
            plan.execute(caller, assetCustodian, rewardTokenLedger);
            return new StakingResponses.ClaimAllResult(caller, claims, plan.rewardPaid());
        });
    }

    @Transactional(readOnly = true)
    public List<StakingResponses.StakeInfo> listStakesByOwner(String ownerWallet) {
        return stakingResponseMapper.toStakeInfos(stakeRegistry.listByOwner(WalletAddresses.normalize(ownerWallet)));
    }

    @Transactional(readOnly = true)
    public StakingResponses.StakeInfo stakeInfo(String assetId) {
        return stakingResponseMapper.toStakeInfo(requireEntry(assetId));
    }

    @Transactional(readOnly = true)
    public StakingResponses.UnbondingTimestamp unbondingTimestamp(String assetId) {
        return new StakingResponses.UnbondingTimestamp(assetId, requireEntry(assetId).getUnbondingAt());
    }

    @Transactional(readOnly = true)
    public StakingResponses.PendingReward pendingReward(String assetId) {
        StakingPool pool = stakingPoolService.readInitializedPool();
        StakeEntry entry = requireEntry(assetId);
        RewardAccrualService.RewardQuote quote =
                rewardAccrualService.quote(pool, entry, chainClock.now(), chainClock.currentBlockHeight());
        return new StakingResponses.PendingReward(assetId, quote.amount(), quote.effectiveBlockHeight());
    }

    @Transactional(readOnly = true)
    public StakingResponses.StakeCount stakeCount(String ownerWallet) {
        String owner = WalletAddresses.normalize(ownerWallet);
        return new StakingResponses.StakeCount(owner, stakeRegistry.countByOwner(owner));
    }

    @Transactional(readOnly = true)
    public List<String> trackedOwners() {
        return stakeRegistry.trackedOwners();
    }

    @Transactional(readOnly = true)
    public List<String> trackedAssets() {
        return stakeRegistry.trackedAssets();
    }

    @Transactional(readOnly = true)
    public StakingResponses.PoolSummary poolSummary() {
        return stakingResponseMapper.toPoolSummary(stakingPoolService.readPool(), chainClock.currentBlockHeight());
    }

    /**
     * Settles the entry's reward and moves it out of STAKED. Forced exits go
     * straight to FREE and owe the early-exit tax.
     */
    private void applyUnstake(
            StakingPool pool,
            StakeEntry entry,
            boolean forceWithTax,
            OffsetDateTime now,
            TransferPlan plan
    ) {
        long reward = rewardAccrualService.settle(pool, entry, now, chainClock.currentBlockHeight());
        plan.payReward(reward);
        pool.setActiveStakesCount(pool.getActiveStakesCount() - 1);

        if (forceWithTax) {
            plan.chargeTax(pool.getEarlyExitTax());
            entry.setState(StakeState.FREE);
            entry.setUnbondingAt(now);
        } else {
            entry.setState(StakeState.UNBONDING);
            entry.setUnbondingAt(now.plusSeconds(pool.getUnbondingPeriodSeconds()));
        }
        entry.setUpdatedAt(now);
        stakeRegistry.save(entry);

        log.info("Unstaked asset {} to {} (forceWithTax={}), reward={}, activeStakes={}",
                entry.getAssetId(), entry.getState(), forceWithTax, reward, pool.getActiveStakesCount());
    }

    private StakingResponses.ClaimResult settleClaim(
            StakingPool pool,
            StakeEntry entry,
            OffsetDateTime now,
            long currentHeight,
            TransferPlan plan
    ) {
        long reward = rewardAccrualService.settle(pool, entry, now, currentHeight);
        entry.setUpdatedAt(now);
        stakeRegistry.save(entry);
        plan.payReward(reward);
        log.debug("Claimed {} reward for asset {} through block {}", reward, entry.getAssetId(), currentHeight);
        return new StakingResponses.ClaimResult(entry.getAssetId(), reward, entry.getLastClaimedBlock());
    }

    private StakeEntry requireEntry(String assetId) {
        return stakeRegistry.get(assetId).orElseThrow(() -> StakingException.entryNotFound(assetId));
    }

    private void requireOwner(StakeEntry entry, String caller) {
        if (!entry.getOwnerWallet().equals(caller)) {
            throw StakingException.callerNotEntryOwner(entry.getAssetId());
        }
    }

    // consulted after the pool row is locked so the gate sees the current flag
    private void requireNotPaused() {
        if (pauseGate.isPaused()) {
            throw StakingException.systemPaused();
        }
    }
}

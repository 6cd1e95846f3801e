package com.vaultstake.controller;

import com.vaultstake.dto.StakingResponses;
import com.vaultstake.service.StakingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Public staking endpoints. The caller is identified by the {@code X-Wallet-Address} header.
 */
@RestController
@RequestMapping("/api/staking")
public class StakingController {

    public static final String WALLET_HEADER = "X-Wallet-Address";

    private final StakingService stakingService;

    public StakingController(StakingService stakingService) {
        this.stakingService = stakingService;
    }

    @PostMapping("/stakes/{assetId}")
    public ResponseEntity<StakingResponses.StakeInfo> stake(
            @PathVariable String assetId,
            @RequestHeader(WALLET_HEADER) String wallet
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakingService.stake(assetId, wallet));
    }

    @PostMapping("/stakes/{assetId}/unstake")
    public ResponseEntity<StakingResponses.UnstakeResult> unstake(
            @PathVariable String assetId,
            @RequestHeader(WALLET_HEADER) String wallet,
            @RequestParam(defaultValue = "false") boolean forceWithTax
    ) {
        return ResponseEntity.ok(stakingService.unstake(assetId, wallet, forceWithTax));
    }

    @PostMapping("/stakes/{assetId}/withdraw")
    public ResponseEntity<StakingResponses.WithdrawResult> withdraw(
            @PathVariable String assetId,
            @RequestHeader(WALLET_HEADER) String wallet,
            @RequestParam(defaultValue = "false") boolean forceWithTax
    ) {
        return ResponseEntity.ok(stakingService.withdraw(assetId, wallet, forceWithTax));
    }

    @PostMapping("/stakes/{assetId}/claim")
    public ResponseEntity<StakingResponses.ClaimResult> claimReward(
            @PathVariable String assetId,
            @RequestHeader(WALLET_HEADER) String wallet
    ) {
        return ResponseEntity.ok(stakingService.claimReward(assetId, wallet));
    }

    @PostMapping("/claims")
    public ResponseEntity<StakingResponses.ClaimAllResult> claimAllRewards(
            @RequestHeader(WALLET_HEADER) String wallet
    ) {
        return ResponseEntity.ok(stakingService.claimAllRewards(wallet));
    }

    @GetMapping("/owners/{owner}/stakes")
    public ResponseEntity<List<StakingResponses.StakeInfo>> listStakesByOwner(@PathVariable String owner) {
        return ResponseEntity.ok(stakingService.listStakesByOwner(owner));
    }

    @GetMapping("/owners/{owner}/count")
    public ResponseEntity<StakingResponses.StakeCount> stakeCount(@PathVariable String owner) {
        return ResponseEntity.ok(stakingService.stakeCount(owner));
    }

    @GetMapping("/stakes/{assetId}")
    public ResponseEntity<StakingResponses.StakeInfo> stakeInfo(@PathVariable String assetId) {
        return ResponseEntity.ok(stakingService.stakeInfo(assetId));
    }

    @GetMapping("/stakes/{assetId}/unbonding")
    public ResponseEntity<StakingResponses.UnbondingTimestamp> unbondingTimestamp(@PathVariable String assetId) {
        return ResponseEntity.ok(stakingService.unbondingTimestamp(assetId));
    }

    @GetMapping("/stakes/{assetId}/reward")
    public ResponseEntity<StakingResponses.PendingReward> pendingReward(@PathVariable String assetId) {
        return ResponseEntity.ok(stakingService.pendingReward(assetId));
    }

    @GetMapping("/tracked/owners")
    public ResponseEntity<List<String>> trackedOwners() {
        return ResponseEntity.ok(stakingService.trackedOwners());
    }

    @GetMapping("/tracked/assets")
    public ResponseEntity<List<String>> trackedAssets() {
        return ResponseEntity.ok(stakingService.trackedAssets());
    }

    @GetMapping("/pool")
    public ResponseEntity<StakingResponses.PoolSummary> poolSummary() {
        return ResponseEntity.ok(stakingService.poolSummary());
    }
}

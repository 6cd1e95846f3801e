package com.vaultstake.controller;

import com.vaultstake.dto.StakingRequests;
import com.vaultstake.dto.StakingResponses;
import com.vaultstake.service.StakingAdminService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.vaultstake.controller.StakingController.WALLET_HEADER;

@RestController
@RequestMapping("/api/admin/staking")
public class StakingAdminController {

    private final StakingAdminService stakingAdminService;

    public StakingAdminController(StakingAdminService stakingAdminService) {
        this.stakingAdminService = stakingAdminService;
    }

    @PostMapping("/initialize")
    public ResponseEntity<StakingResponses.PoolSummary> initialize(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.InitializeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakingAdminService.initialize(wallet, request));
    }

    @PutMapping("/stake-limit")
    public ResponseEntity<StakingResponses.PoolSummary> setStakeLimit(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateAmountRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setStakeLimit(wallet, request.value()));
    }

    @PutMapping("/reward-per-block")
    public ResponseEntity<StakingResponses.PoolSummary> setRewardPerBlock(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateAmountRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setRewardPerBlock(wallet, request.value()));
    }

    @PutMapping("/early-exit-tax")
    public ResponseEntity<StakingResponses.PoolSummary> setEarlyExitTax(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateAmountRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setEarlyExitTax(wallet, request.value()));
    }

    @PutMapping("/carry-amount")
    public ResponseEntity<StakingResponses.PoolSummary> setCarryAmount(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateAmountRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setCarryAmount(wallet, request.value()));
    }

    @PutMapping("/staking-end-time")
    public ResponseEntity<StakingResponses.PoolSummary> setStakingEndTime(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateDurationRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setStakingEndTime(wallet, request.hours()));
    }

    @PutMapping("/unbonding-period")
    public ResponseEntity<StakingResponses.PoolSummary> setUnbondingPeriod(
            @RequestHeader(WALLET_HEADER) String wallet,
            @Valid @RequestBody StakingRequests.UpdateDurationRequest request
    ) {
        return ResponseEntity.ok(stakingAdminService.setUnbondingPeriod(wallet, request.hours()));
    }

    @PostMapping("/pause")
    public ResponseEntity<StakingResponses.PoolSummary> pause(@RequestHeader(WALLET_HEADER) String wallet) {
        return ResponseEntity.ok(stakingAdminService.pause(wallet));
    }

    @PostMapping("/unpause")
    public ResponseEntity<StakingResponses.PoolSummary> unpause(@RequestHeader(WALLET_HEADER) String wallet) {
        return ResponseEntity.ok(stakingAdminService.unpause(wallet));
    }

    @PostMapping("/reward-pool/withdraw")
    public ResponseEntity<StakingResponses.RewardPoolWithdrawal> withdrawRewardPool(
            @RequestHeader(WALLET_HEADER) String wallet
    ) {
        return ResponseEntity.ok(stakingAdminService.forceWithdrawRewardPool(wallet));
    }

    @PostMapping("/assets/{assetId}/withdraw")
    public ResponseEntity<StakingResponses.AssetWithdrawal> withdrawAsset(
            @RequestHeader(WALLET_HEADER) String wallet,
            @PathVariable String assetId
    ) {
        return ResponseEntity.ok(stakingAdminService.forceWithdrawAsset(wallet, assetId));
    }
}

package com.vaultstake.controller;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.custody.LedgerAssetCustodian;
import com.vaultstake.custody.LedgerRewardTokenLedger;
import com.vaultstake.dto.StakingRequests;
import com.vaultstake.dto.StakingResponses;
import com.vaultstake.security.WalletAddresses;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local-mode faucet for seeding assets and reward token balances.
 */
@RestController
@RequestMapping("/api/custody/local")
@ConditionalOnProperty(prefix = "staking.custody", name = "local-faucet-enabled", havingValue = "true")
public class LocalCustodyController {

    private final LedgerAssetCustodian assetCustodian;
    private final LedgerRewardTokenLedger rewardTokenLedger;
    private final StakingProperties stakingProperties;

    public LocalCustodyController(
            LedgerAssetCustodian assetCustodian,
            LedgerRewardTokenLedger rewardTokenLedger,
            StakingProperties stakingProperties
    ) {
        this.assetCustodian = assetCustodian;
        this.rewardTokenLedger = rewardTokenLedger;
        this.stakingProperties = stakingProperties;
    }

    @PostMapping("/assets")
    public ResponseEntity<Void> mintAsset(@Valid @RequestBody StakingRequests.MintAssetRequest request) {
        assetCustodian.mint(request.assetId(), WalletAddresses.normalize(request.holder()));
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PostMapping("/tokens")
    public ResponseEntity<StakingResponses.TokenBalanceResponse> creditTokens(
            @Valid @RequestBody StakingRequests.CreditTokensRequest request
    ) {
        String holder = WalletAddresses.normalize(request.holder());
        rewardTokenLedger.credit(holder, request.amount());
        return ResponseEntity.ok(new StakingResponses.TokenBalanceResponse(holder, rewardTokenLedger.balanceOf(holder)));
    }

    @PostMapping("/reward-pool")
    public ResponseEntity<StakingResponses.TokenBalanceResponse> fundRewardPool(
            @Valid @RequestBody StakingRequests.UpdateAmountRequest request
    ) {
        String vault = stakingProperties.getCustody().getVaultAccount();
        rewardTokenLedger.credit(vault, request.value());
        return ResponseEntity.ok(new StakingResponses.TokenBalanceResponse(vault, rewardTokenLedger.vaultBalance()));
    }

    @GetMapping("/tokens/{holder}")
    public ResponseEntity<StakingResponses.TokenBalanceResponse> balance(@PathVariable String holder) {
        String normalized = WalletAddresses.normalize(holder);
        return ResponseEntity.ok(new StakingResponses.TokenBalanceResponse(normalized, rewardTokenLedger.balanceOf(normalized)));
    }
}

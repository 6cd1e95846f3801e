package com.vaultstake.service;

import com.vaultstake.custody.AssetCustodian;
import com.vaultstake.custody.RewardTokenLedger;

import java.util.ArrayList;
import java.util.List;

/**
 * Custody transfers collected while an operation updates ledger state and
 * executed only once that state is final.
 */
final class TransferPlan {

    private long taxCharged;
    private long rewardPaid;
    private long carryReturned;
    private final List<String> assetsReturned = new ArrayList<>();

    void chargeTax(long amount) {
        taxCharged = Math.addExact(taxCharged, amount);
    }

    void payReward(long amount) {
        rewardPaid = Math.addExact(rewardPaid, amount);
    }

    void returnCarry(long amount) {
        carryReturned = Math.addExact(carryReturned, amount);
    }

    void returnAsset(String assetId) {
        assetsReturned.add(assetId);
    }

    long taxCharged() {
        return taxCharged;
    }

    long rewardPaid() {
        return rewardPaid;
    }

    long carryReturned() {
        return carryReturned;
    }

    void execute(String wallet, AssetCustodian assetCustodian, RewardTokenLedger rewardTokenLedger) {
        if (taxCharged > 0) {
            rewardTokenLedger.transferIn(wallet, taxCharged);
        }
        if (rewardPaid > 0) {
            rewardTokenLedger.transferOut(wallet, rewardPaid);
        }
        for (String assetId : assetsReturned) {
            assetCustodian.releaseFromCustody(wallet, assetId);
        }
        if (carryReturned > 0) {
            rewardTokenLedger.transferOut(wallet, carryReturned);
        }
    }
}

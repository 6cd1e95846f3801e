package com.vaultstake.custody;

/**
 * Fungible reward token moving between wallets and the staking vault.
 */
public interface RewardTokenLedger {

    void transferIn(String from, long amount);

    void transferOut(String to, long amount);

    long balanceOf(String holder);

    long vaultBalance();
}

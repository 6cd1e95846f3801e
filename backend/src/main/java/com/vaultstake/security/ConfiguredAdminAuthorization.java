package com.vaultstake.security;

import com.vaultstake.config.StakingProperties;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Grants every privileged action to the wallets listed in {@code staking.admin-wallets}.
 * The list is checksummed once at startup; a malformed entry fails the context.
 */
@Component
public class ConfiguredAdminAuthorization implements StakingAuthorization {

    private final Set<String> adminWallets;

    public ConfiguredAdminAuthorization(StakingProperties stakingProperties) {
        Set<String> wallets = new LinkedHashSet<>();
        for (String wallet : stakingProperties.getAdminWallets()) {
            if (wallet == null || wallet.isBlank()) {
                continue;
            }
            String trimmed = wallet.trim();
            if (!WalletUtils.isValidAddress(trimmed)) {
                throw new IllegalStateException("staking.admin-wallets contains an invalid wallet address: " + wallet);
            }
            wallets.add(Keys.toChecksumAddress(trimmed));
        }
        this.adminWallets = Set.copyOf(wallets);
    }

    @Override
    public boolean isAuthorized(String caller, StakingAction action) {
        return caller != null && adminWallets.contains(caller);
    }
}

package com.vaultstake.security;

import com.vaultstake.web.StakingException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

/**
 * Normalises caller wallets to EIP-55 checksum form so the same wallet always
 * maps to the same registry key.
 */
public final class WalletAddresses {

    private WalletAddresses() {
    }

    public static String normalize(String value) {
        if (value == null) {
            throw StakingException.invalidWalletAddress(null);
        }
        String trimmed = value.trim();
        if (!WalletUtils.isValidAddress(trimmed)) {
            throw StakingException.invalidWalletAddress(value);
        }
        return Keys.toChecksumAddress(trimmed);
    }
}

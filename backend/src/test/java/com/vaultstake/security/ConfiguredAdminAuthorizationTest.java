package com.vaultstake.security;

import com.vaultstake.config.StakingProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfiguredAdminAuthorizationTest {

    private static final String ADMIN = "0x52908400098527886E0F7030069857D2E4169EE7";

    @Test
    void isAuthorized_matchesConfiguredWalletInAnyCase() {
        StakingProperties properties = new StakingProperties();
        properties.setAdminWallets(List.of("", " " + ADMIN.toLowerCase() + " "));
        ConfiguredAdminAuthorization authorization = new ConfiguredAdminAuthorization(properties);

        assertTrue(authorization.isAuthorized(ADMIN, StakingAction.PAUSE));
        assertFalse(authorization.isAuthorized("0x1111111111111111111111111111111111111111", StakingAction.PAUSE));
        assertFalse(authorization.isAuthorized(null, StakingAction.PAUSE));
    }

    @Test
    void isAuthorized_deniesEveryoneWithoutConfiguredAdmins() {
        ConfiguredAdminAuthorization authorization = new ConfiguredAdminAuthorization(new StakingProperties());

        assertFalse(authorization.isAuthorized(ADMIN, StakingAction.INITIALIZE));
    }

    @Test
    void constructor_rejectsMalformedConfiguredWallet() {
        StakingProperties properties = new StakingProperties();
        properties.setAdminWallets(List.of(ADMIN, "not-a-wallet"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new ConfiguredAdminAuthorization(properties));

        assertEquals("staking.admin-wallets contains an invalid wallet address: not-a-wallet", ex.getMessage());
    }

    @Test
    void isAuthorized_doesNotRenormaliseCallers() {
        StakingProperties properties = new StakingProperties();
        properties.setAdminWallets(List.of(ADMIN));
        ConfiguredAdminAuthorization authorization = new ConfiguredAdminAuthorization(properties);

        assertTrue(authorization.isAuthorized(ADMIN, StakingAction.WITHDRAW_ASSET));
        assertFalse(authorization.isAuthorized("not-a-wallet", StakingAction.WITHDRAW_ASSET));
    }
}

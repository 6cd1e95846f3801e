package com.vaultstake.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for the staking ledger.
 * Pool parameters live in the database once initialised; the bootstrap block
 * only seeds them on first start.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {

    /**
     * Average block time used to derive block heights from wall-clock time.
     */
    private long averageBlockTimeMs = 400L;

    /**
     * Wallets allowed to call privileged operations.
     */
    private List<String> adminWallets = new ArrayList<>();

    private Chain chain = new Chain();
    private Custody custody = new Custody();
    private Bootstrap bootstrap = new Bootstrap();

    @Getter
    @Setter
    public static class Chain {
        /**
         * {@code local} derives heights from the wall clock, {@code solana} reads the RPC slot.
         */
        private String mode = "local";
        private OffsetDateTime genesis = OffsetDateTime.parse("2024-01-01T00:00:00Z");
        private Solana solana = new Solana();
    }

    @Getter
    @Setter
    public static class Solana {
        private String rpcUrl = "https://api.devnet.solana.com";
        /**
         * Staking program account reported by the health endpoint. Blank skips the check.
         */
        private String programId = "";
    }

    @Getter
    @Setter
    public static class Custody {
        private String vaultAccount = "vault";
        private boolean localFaucetEnabled = false;
    }

    @Getter
    @Setter
    public static class Bootstrap {
        private boolean enabled = false;
        private String collectionAddress = "0x0000000000000000000000000000000000000000";
        private String rewardTokenAddress = "0x0000000000000000000000000000000000000000";
        private long rewardPerBlock = 100L;
        private long earlyExitTax = 1_000L;
        private long stakeLimit = 1_000L;
        private long carryAmount = 500L;
        private long stakingDurationHours = 24L * 90L;
        private long unbondingPeriodHours = 24L * 7L;
    }
}

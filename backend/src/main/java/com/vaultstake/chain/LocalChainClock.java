package com.vaultstake.chain;

import com.vaultstake.config.StakingProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Derives block heights from elapsed time since a configured genesis.
 */
@Component
@ConditionalOnProperty(prefix = "staking.chain", name = "mode", havingValue = "local", matchIfMissing = true)
public class LocalChainClock implements ChainClock {

    private final Clock clock;
    private final StakingProperties stakingProperties;

    public LocalChainClock(Clock clock, StakingProperties stakingProperties) {
        this.clock = clock;
        this.stakingProperties = stakingProperties;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @Override
    public long currentBlockHeight() {
        OffsetDateTime genesis = stakingProperties.getChain().getGenesis();
        OffsetDateTime now = now();
        if (!now.isAfter(genesis)) {
            return 0L;
        }
        return Duration.between(genesis, now).toMillis() / stakingProperties.getAverageBlockTimeMs();
    }

    @Override
    public String mode() {
        return "local";
    }
}

package com.vaultstake.chain;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Uses the Solana slot as the block height.
 */
@Component
@ConditionalOnProperty(prefix = "staking.chain", name = "mode", havingValue = "solana")
public class SolanaChainClock implements ChainClock {

    private final Clock clock;
    private final SolanaSlotReader solanaSlotReader;

    public SolanaChainClock(Clock clock, SolanaSlotReader solanaSlotReader) {
        this.clock = clock;
        this.solanaSlotReader = solanaSlotReader;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @Override
    public long currentBlockHeight() {
        return solanaSlotReader.currentSlot();
    }

    @Override
    public String mode() {
        return "solana";
    }
}

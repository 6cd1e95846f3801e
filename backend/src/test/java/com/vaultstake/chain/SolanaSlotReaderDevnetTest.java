package com.vaultstake.chain;

import com.vaultstake.config.StakingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.p2p.solanaj.rpc.RpcClient;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Devnet connectivity checks. Run with {@code SOLANA_TEST_DEVNET=true mvn test}.
 */
@EnabledIfEnvironmentVariable(named = "SOLANA_TEST_DEVNET", matches = "true")
class SolanaSlotReaderDevnetTest {

    private static final String LOADER_PROGRAM = "BPFLoaderUpgradeab1e11111111111111111111111";

    private SolanaSlotReader solanaSlotReader;

    @BeforeEach
    void setUp() {
        StakingProperties properties = new StakingProperties();
        properties.getChain().getSolana().setProgramId(LOADER_PROGRAM);
        solanaSlotReader = new SolanaSlotReader(
                new RpcClient(properties.getChain().getSolana().getRpcUrl()), properties);
    }

    @Test
    void currentSlot_isPositive() {
        long slot = solanaSlotReader.currentSlot();
        assertTrue(slot > 0, "Slot should be positive, got: " + slot);
    }

    @Test
    void programStatus_findsLoaderProgram() {
        assertTrue(solanaSlotReader.programStatus().orElseThrow().deployed());
    }
}

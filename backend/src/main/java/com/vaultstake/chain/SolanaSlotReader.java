package com.vaultstake.chain;

import com.vaultstake.config.StakingProperties;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the Solana slot used as the ledger's block height and looks up the
 * staking program account for the health endpoint.
 */
@Component
@ConditionalOnProperty(prefix = "staking.chain", name = "mode", havingValue = "solana")
public class SolanaSlotReader {

    private static final Logger log = LoggerFactory.getLogger(SolanaSlotReader.class);

    private final RpcClient rpcClient;
    private final String programId;

    public SolanaSlotReader(RpcClient rpcClient, StakingProperties stakingProperties) {
        this.rpcClient = rpcClient;
        this.programId = stakingProperties.getChain().getSolana().getProgramId();
    }

    public long currentSlot() {
        try {
            long slot = rpcClient.getApi().getSlot();
            log.debug("Solana slot {} read as block height", slot);
            return slot;
        } catch (RpcException e) {
            throw new IllegalStateException("Unable to read current Solana slot", e);
        }
    }

    /**
     * Empty when no program id is configured.
     */
    public Optional<ProgramStatus> programStatus() {
        if (programId == null || programId.isBlank()) {
            return Optional.empty();
        }
        try {
            var account = rpcClient.getApi().getAccountInfo(new PublicKey(programId));
            boolean deployed = account != null && account.getValue() != null;
            if (!deployed) {
                log.warn("Staking program account {} not found on chain", programId);
            }
            return Optional.of(new ProgramStatus(programId, deployed));
        } catch (RpcException e) {
            throw new IllegalStateException("Unable to look up staking program account " + programId, e);
        }
    }

    public record ProgramStatus(String programId, boolean deployed) {
    }
}

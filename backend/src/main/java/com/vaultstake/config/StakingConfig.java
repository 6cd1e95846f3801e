package com.vaultstake.config;

import org.p2p.solanaj.rpc.RpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StakingConfig {

    private static final Logger log = LoggerFactory.getLogger(StakingConfig.class);

    @Bean
    public Clock stakingClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "staking.chain", name = "mode", havingValue = "solana")
    public RpcClient solanaRpcClient(StakingProperties stakingProperties) {
        String rpcUrl = stakingProperties.getChain().getSolana().getRpcUrl();
        log.info("Reading block heights from Solana slots via {}", rpcUrl);
        return new RpcClient(rpcUrl);
    }
}

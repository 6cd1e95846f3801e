package com.vaultstake.service;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.dto.StakingRequests;
import com.vaultstake.model.StakingPool;
import com.vaultstake.repository.StakingPoolRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Initializes the staking pool from configuration on startup when enabled.
 */
@Component
public class StakingBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StakingBootstrapService.class);

    private final StakingProperties stakingProperties;
    private final StakingPoolRepository stakingPoolRepository;
    private final StakingAdminService stakingAdminService;

    public StakingBootstrapService(
            StakingProperties stakingProperties,
            StakingPoolRepository stakingPoolRepository,
            StakingAdminService stakingAdminService
    ) {
        this.stakingProperties = stakingProperties;
        this.stakingPoolRepository = stakingPoolRepository;
        this.stakingAdminService = stakingAdminService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!stakingProperties.getBootstrap().isEnabled()) {
            log.debug("Staking pool bootstrap disabled.");
            return;
        }
        boolean initialized = stakingPoolRepository.findById(StakingPool.SINGLETON_ID)
                .map(StakingPool::isInitialized)
                .orElse(false);
        if (initialized) {
            log.debug("Staking pool bootstrap skipped: pool already initialized.");
            return;
        }

        StakingProperties.Bootstrap bootstrap = stakingProperties.getBootstrap();
        stakingAdminService.initializePool(new StakingRequests.InitializeRequest(
                bootstrap.getCollectionAddress(),
                bootstrap.getRewardTokenAddress(),
                bootstrap.getRewardPerBlock(),
                bootstrap.getEarlyExitTax(),
                bootstrap.getStakeLimit(),
                bootstrap.getCarryAmount(),
                bootstrap.getStakingDurationHours(),
                bootstrap.getUnbondingPeriodHours()
        ));
        log.info("Bootstrapped staking pool from configuration.");
    }
}
